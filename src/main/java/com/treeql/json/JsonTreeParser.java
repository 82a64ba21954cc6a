package com.treeql.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads JSON text into a mutable {@link JsonNode} tree. Object keys keep document order.
 */
public class JsonTreeParser {
    private final JsonFactory factory = new JsonFactory();

    public JsonNode parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseValue(parser, parser.nextToken());
        }
    }

    public JsonNode parse(String json) {
        try (JsonParser parser = factory.createParser(json)) {
            return parseValue(parser, parser.nextToken());
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    private JsonNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> JsonNode.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> JsonNode.JsonNumber.of(parser.getDoubleValue());
            case VALUE_TRUE -> new JsonNode.JsonBoolean(true);
            case VALUE_FALSE -> new JsonNode.JsonBoolean(false);
            case VALUE_NULL -> JsonNode.NULL;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonNode.JsonObject parseObject(JsonParser parser) throws IOException {
        JsonNode.JsonObject object = JsonNode.JsonObject.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            object.fields().put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return object;
    }

    private JsonNode.JsonArray parseArray(JsonParser parser) throws IOException {
        JsonNode.JsonArray array = JsonNode.JsonArray.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            array.elements().add(parseValue(parser, token));
        }

        return array;
    }
}
