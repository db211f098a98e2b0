package at.sv.energy.api;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * The body of a successful response: either a parsed JSON tree (for a JSON content type), or the raw text.
 */
@EqualsAndHashCode
@ToString
public final class RawResult {

    private final JsonNode json;
    private final String text;

    private RawResult(JsonNode json, String text) {
        this.json = json;
        this.text = text;
    }

    public static RawResult json(JsonNode json) {
        return new RawResult(json, null);
    }

    public static RawResult text(String text) {
        return new RawResult(null, text);
    }

    public boolean isJson() {
        return json != null;
    }

    /**
     * @return the parsed body. Not null.
     * @throws DeviceConnectionFailure if the device did not answer with JSON
     */
    public JsonNode getJson() {
        if (json == null) {
            throw new DeviceConnectionFailure("Expected a JSON response, but got: '" + text + "'");
        }
        return json;
    }

    /**
     * @return the raw text of a non-JSON body, or the serialized JSON tree
     */
    public String getText() {
        if (text == null) {
            return json.toString();
        }
        return text;
    }
}
