package com.fnparser.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fnparser.Diagnostic;
import com.fnparser.ParseError;
import com.fnparser.ParseErrors;
import com.fnparser.ast.Node;
import com.fnparser.ast.Spanned;
import com.fnparser.json.AstJsonException;
import com.fnparser.json.AstJsonProvider;
import com.fnparser.json.AstJsonSerializer;

import java.util.Locale;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = FugueJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializeDiagnostics(ParseErrors errors) throws AstJsonException {
            ArrayNode array = mapper.createArrayNode();
            for (Spanned<ParseError> error : errors) {
                Diagnostic diagnostic = error.value().asDiagnostic();
                ObjectNode entry = array.addObject();
                entry.put("start", error.start());
                entry.put("end", error.end());
                entry.put("severity", diagnostic.severity().name().toLowerCase(Locale.ROOT));
                entry.put("kind", error.value().getClass().getSimpleName());
                entry.put("message", diagnostic.message());
            }
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(array);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize diagnostics", e);
            }
        }
    }
}
