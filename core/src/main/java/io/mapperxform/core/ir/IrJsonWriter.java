package io.mapperxform.core.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mapperxform.core.model.MapperMetadata;
import io.mapperxform.core.model.SchemaSet;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Renders a {@link MapperIR} as JSON, the format consumed by the code generators.
 *
 * <p>Every expression object carries a {@code kind} discriminator. Absent optional values are
 * omitted rather than written as {@code null}.
 *
 * <p>Thread-safe: stateless apart from a shared, immutable {@link ObjectMapper}.
 */
public final class IrJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /** Converts the IR into a Jackson tree. */
    public ObjectNode toJson(MapperIR ir) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", ir.version());
        root.set("schemas", schemasToJson(ir.schemas()));

        ArrayNode mappings = root.putArray("mappings");
        for (FieldMapping mapping : ir.mappings()) {
            ObjectNode node = mappings.addObject();
            node.put("target", mapping.target());
            node.set("expression", toJson(mapping.expression()));
            if (mapping.type() != null) {
                node.put("type", mapping.type());
            }
        }

        if (ir.sharedExpressions() != null) {
            ArrayNode shared = root.putArray("sharedExpressions");
            for (SharedExpression expr : ir.sharedExpressions()) {
                ObjectNode node = shared.addObject();
                node.put("nodeId", expr.nodeId());
                node.put("varName", expr.varName());
                node.set("expression", toJson(expr.expression()));
                if (expr.hintName() != null) {
                    node.put("hintName", expr.hintName());
                }
                node.put("refCount", expr.refCount());
            }
        }

        root.set("metadata", metadataToJson(ir.metadata()));
        return root;
    }

    /** Renders the IR as indented JSON text. */
    public String toJsonString(MapperIR ir) {
        try {
            return MAPPER.writeValueAsString(toJson(ir));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize mapper IR", e);
        }
    }

    /** Converts a single expression into a Jackson tree. */
    public ObjectNode toJson(Expression expr) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("kind", expr.kind());
        if (expr instanceof Expression.Literal literal) {
            node.set("value", literalValue(literal));
            node.put("type", literal.type().wireName());
        } else if (expr instanceof Expression.Field field) {
            node.put("path", field.path());
        } else if (expr instanceof Expression.SharedRef ref) {
            node.put("nodeId", ref.nodeId());
            node.put("varName", ref.varName());
        } else if (expr instanceof Expression.UnresolvedRef ref) {
            node.put("nodeId", ref.nodeId());
        } else if (expr instanceof Expression.Binary binary) {
            node.put("operator", binary.operator().wireName());
            node.set("left", toJson(binary.left()));
            node.set("right", toJson(binary.right()));
        } else if (expr instanceof Expression.Unary unary) {
            node.put("operator", unary.operator().wireName());
            node.set("operand", toJson(unary.operand()));
        } else if (expr instanceof Expression.Call call) {
            node.put("function", call.function().wireName());
            ArrayNode args = node.putArray("args");
            call.args().forEach(arg -> args.add(toJson(arg)));
            if (call.config() != null) {
                node.set("config", call.config().deepCopy());
            }
        } else if (expr instanceof Expression.Conditional conditional) {
            node.set("condition", toJson(conditional.condition()));
            node.set("then", toJson(conditional.then()));
            node.set("else", toJson(conditional.otherwise()));
        } else if (expr instanceof Expression.ArrayLiteral array) {
            ArrayNode elements = node.putArray("elements");
            array.elements().forEach(el -> elements.add(toJson(el)));
        } else if (expr instanceof Expression.ObjectLiteral object) {
            ArrayNode properties = node.putArray("properties");
            for (Expression.ObjectLiteral.Entry entry : object.entries()) {
                ObjectNode property = properties.addObject();
                property.put("key", entry.key());
                property.set("value", toJson(entry.value()));
            }
        }
        return node;
    }

    private static JsonNode literalValue(Expression.Literal literal) {
        Object value = literal.value();
        if (value == null) {
            return MAPPER.nullNode();
        }
        if (value instanceof Boolean b) {
            return MAPPER.getNodeFactory().booleanNode(b);
        }
        if (value instanceof Long l) {
            return MAPPER.getNodeFactory().numberNode(l);
        }
        if (value instanceof Integer i) {
            return MAPPER.getNodeFactory().numberNode(i);
        }
        if (value instanceof Double d) {
            return MAPPER.getNodeFactory().numberNode(d);
        }
        if (value instanceof BigInteger bi) {
            return MAPPER.getNodeFactory().numberNode(bi);
        }
        if (value instanceof BigDecimal bd) {
            return MAPPER.getNodeFactory().numberNode(bd);
        }
        if (value instanceof Number n) {
            return MAPPER.getNodeFactory().numberNode(n.doubleValue());
        }
        return MAPPER.getNodeFactory().textNode(String.valueOf(value));
    }

    private static ObjectNode schemasToJson(SchemaSet schemas) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("source", schemas.source());
        node.put("target", schemas.target());
        return node;
    }

    private static ObjectNode metadataToJson(MapperMetadata metadata) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", metadata.name());
        putIfPresent(node, "description", metadata.description());
        putIfPresent(node, "author", metadata.author());
        putIfPresent(node, "version", metadata.version());
        putIfPresent(node, "createdAt", metadata.createdAt());
        putIfPresent(node, "updatedAt", metadata.updatedAt());
        return node;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
