package com.fnparser.infix;

/**
 * Associativity and precedence of a binary operator. Higher precedence binds tighter.
 */
public record OpMeta(Fixity fixity, int precedence) {

    public static final OpMeta DEFAULT = new OpMeta(Fixity.LEFT, 0);

    /**
     * Parses the argument text of an {@code #[infix(...)]} attribute: {@code "left, 6"} or
     * {@code "right, 0"}.
     */
    public static OpMeta parse(String text) throws InfixException {
        String[] parts = text.split(",", 2);
        Fixity fixity = switch (parts[0].trim()) {
            case "left" -> Fixity.LEFT;
            case "right" -> Fixity.RIGHT;
            default -> throw new InfixException(new InfixError.InvalidFixity());
        };
        if (parts.length < 2) {
            throw new InfixException(new InfixError.InvalidPrecedence());
        }
        String digits = parts[1].trim();
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new InfixException(new InfixError.InvalidPrecedence());
        }
        try {
            return new OpMeta(fixity, Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            throw new InfixException(new InfixError.InvalidPrecedence());
        }
    }

    @Override
    public String toString() {
        return fixity + " " + precedence;
    }
}
