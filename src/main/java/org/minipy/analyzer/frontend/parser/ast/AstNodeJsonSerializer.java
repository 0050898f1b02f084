package org.minipy.analyzer.frontend.parser.ast;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.List;

/**
 * Writes a syntax tree as nested objects of the form
 * {@code {"type": ..., "value": ..., "line": ..., "children": [...]}}.
 * The {@code value} field is omitted when the node has no payload and
 * {@code children} is omitted when the node has none.
 */
public class AstNodeJsonSerializer extends StdSerializer<AstNode> {

    public AstNodeJsonSerializer() {
        super(AstNode.class);
    }

    @Override
    public void serialize(AstNode node, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", node.kind().displayName());
        if (node.value() != null) {
            gen.writeStringField("value", node.value());
        }
        gen.writeNumberField("line", node.line());
        List<AstNode> children = node.getChildren();
        if (!children.isEmpty()) {
            gen.writeArrayFieldStart("children");
            for (AstNode child : children) {
                serialize(child, gen, provider);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }
}
