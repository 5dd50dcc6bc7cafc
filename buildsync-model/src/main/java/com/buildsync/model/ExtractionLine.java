package com.buildsync.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One typed extraction rule of a field. Lines of type {@value #UDF_LINE_TYPE} invoke a user-defined
 * function through {@code function_id}.
 */
public final class ExtractionLine {

    public static final String UDF_LINE_TYPE = "UDF";
    static final String LINE_TYPE = "line_type";
    static final String FUNCTION_ID = "function_id";

    private final ObjectNode body;

    ExtractionLine(JsonNode body) {
        this.body = BuildJson.copyObject(body);
    }

    public String getLineType() {
        JsonNode type = body.get(LINE_TYPE);
        return type != null && !type.isNull() ? type.asText() : null;
    }

    public boolean isUdf() {
        return UDF_LINE_TYPE.equals(getLineType());
    }

    /** Id of the invoked UDF, or {@code null} when the line carries none. */
    public String getFunctionId() {
        return Identifiers.asKey(body.get(FUNCTION_ID));
    }

    /** Returns a copy of this line invoking the given UDF id. */
    public ExtractionLine withFunctionId(String functionId) {
        ObjectNode copy = body.deepCopy();
        copy.set(FUNCTION_ID, Identifiers.toNode(functionId));
        return new ExtractionLine(copy);
    }

    public ObjectNode toTree() {
        return body.deepCopy();
    }
}
