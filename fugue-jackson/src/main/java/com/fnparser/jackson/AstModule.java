package com.fnparser.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fnparser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that configures serialization for the AST records.
 *
 * This module handles:
 * - A leading {@code type} property on every node record
 * - Symbols and typed identifiers written as plain names
 * - Literal values written as JSON numbers, strings or characters
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.fnparser", "fugue-jackson"));
        addSerializer(Symbol.class, ToStringSerializer.instance);
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixins on the sealed interfaces are not inherited reliably, so every record gets its own
        for (Class<?> nodeClass : nodeClasses(Node.class)) {
            context.setMixInAnnotations(nodeClass, NodeMixin.class);
        }
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(TypedIdent.class, TypedIdentMixin.class);
        context.setMixInAnnotations(Metadata.class, MetadataMixin.class);
    }

    /**
     * Concrete classes reachable from {@code root} through sealed {@code permits} clauses.
     */
    static List<Class<?>> nodeClasses(Class<?> root) {
        List<Class<?>> result = new ArrayList<>();
        collect(root, result);
        return result;
    }

    private static void collect(Class<?> type, List<Class<?>> out) {
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null) {
            out.add(type);
            return;
        }
        for (Class<?> sub : permitted) {
            collect(sub, out);
        }
    }

    // ==================== Serialization Mixins ====================

    @JsonPropertyOrder({"type", "start", "end"})
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();
    }

    @JsonPropertyOrder({"type", "start", "end"})
    private abstract static class LiteralMixin extends NodeMixin {
        @JsonSerialize(using = LiteralValueSerializer.class)
        abstract Object value();
    }

    // The type of an identifier is always a hole at parse time
    private abstract static class TypedIdentMixin {
        @JsonValue
        abstract Symbol name();
    }

    private abstract static class MetadataMixin {
        @JsonIgnore
        abstract boolean isEmpty();
    }
}
