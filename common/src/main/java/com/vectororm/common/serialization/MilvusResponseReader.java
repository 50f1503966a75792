package com.vectororm.common.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vectororm.common.client.VectorStoreException;
import com.vectororm.common.model.InsertResult;
import com.vectororm.common.model.SearchHit;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes Milvus RESTful v2 response envelopes ({@code {"code": 0, "data": ...}}).
 * Integral numbers are read as {@link Long}, fractional ones as {@link Double}.
 */
public class MilvusResponseReader {

    public static final String DISTANCE_KEY = "distance";
    public static final String COUNT_KEY = "count(*)";

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public MilvusResponseReader() {
        this(new ObjectMapper());
    }

    public MilvusResponseReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.USE_LONG_FOR_INTS);
    }

    public List<Map<String, Object>> readRows(byte[] body) {
        JsonNode data = readData(body);
        List<Map<String, Object>> rows = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            rows.add(toRow(row));
        }
        return rows;
    }

    public List<SearchHit> readHits(byte[] body) {
        JsonNode data = readData(body);
        List<SearchHit> hits = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            Map<String, Object> entity = toRow(row);
            Object distance = entity.remove(DISTANCE_KEY);
            if (!(distance instanceof Number number)) {
                throw new VectorStoreException("Search hit without numeric distance: " + row);
            }
            hits.add(new SearchHit(entity, number.doubleValue()));
        }
        return hits;
    }

    public InsertResult readInsert(byte[] body) {
        JsonNode data = readData(body);
        long insertCount = data.path("insertCount").asLong(0);
        List<Object> keys = new ArrayList<>();
        for (JsonNode id : data.path("insertIds")) {
            keys.add(id.isIntegralNumber() ? id.asLong() : id.asText());
        }
        return new InsertResult(insertCount, keys);
    }

    public long readDeleteCount(byte[] body) {
        JsonNode data = readData(body);
        JsonNode count = data.path("deleteCount");
        return count.isNumber() ? count.asLong() : -1L;
    }

    public long readCount(byte[] body) {
        JsonNode data = readData(body);
        JsonNode count = data.path(0).path(COUNT_KEY);
        if (!count.isNumber()) {
            throw new VectorStoreException("Count response without " + COUNT_KEY + " value");
        }
        return count.asLong();
    }

    private JsonNode readData(byte[] body) {
        if (body == null) {
            throw new IllegalArgumentException("Response body cannot be null");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new VectorStoreException("Malformed response from vector store", e);
        }

        int code = root.path("code").asInt(0);
        // v2 reports success as 0, some gateways still answer 200
        if (code != 0 && code != 200) {
            throw new VectorStoreException(code, root.path("message").asText("Unknown vector store error"));
        }
        return root.path("data");
    }

    private Map<String, Object> toRow(JsonNode row) {
        if (!row.isObject()) {
            throw new VectorStoreException("Expected a JSON object row but got " + row.getNodeType());
        }
        return objectMapper.convertValue(row, ROW_TYPE);
    }
}
