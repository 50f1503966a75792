package com.vectororm.orm.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vectororm.common.client.VectorStoreException;
import com.vectororm.common.model.ConsistencyLevel;
import com.vectororm.common.model.InsertResult;
import com.vectororm.common.model.QueryRequest;
import com.vectororm.common.model.SearchHit;
import com.vectororm.common.model.SearchRequest;
import com.vectororm.common.model.SortKey;
import com.vectororm.common.serialization.MilvusResponseReader;
import com.vectororm.orm.exception.QueryConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MilvusRestClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();

    private HttpStatus status;
    private String responseBody;
    private MilvusRestClientFactory factory;

    @BeforeEach
    void setUp() {
        status = HttpStatus.OK;
        responseBody = "{\"code\":0,\"data\":[]}";
        ExchangeFunction exchange = request -> {
            MockClientHttpRequest written = new MockClientHttpRequest(request.method(), request.url());
            return request.writeTo(written, ExchangeStrategies.withDefaults())
                    .then(Mono.defer(written::getBodyAsString))
                    .map(body -> {
                        requests.add(request);
                        bodies.add(body);
                        return ClientResponse.create(status)
                                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                                .body(responseBody)
                                .build();
                    });
        };
        factory = new MilvusRestClientFactory(WebClient.builder().exchangeFunction(exchange),
                new MilvusResponseReader(), 1000);
    }

    @Test
    @DisplayName("Query posts the filter and asks for the rest of the window after the offset")
    void shouldQuery() throws Exception {
        responseBody = "{\"code\":0,\"data\":[{\"id\":1,\"title\":\"Python\"},{\"id\":2,\"title\":\"Java\"}]}";
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);

        List<Map<String, Object>> rows = client.query(
                new QueryRequest("note", "id > 0", List.of("id", "title"), null, 5, null, null)).block();

        assertThat(rows).containsExactly(Map.of("id", 1L, "title", "Python"), Map.of("id", 2L, "title", "Java"));
        assertThat(requests.get(0).url().toString()).isEqualTo("http://milvus:19530/v2/vectordb/entities/query");
        assertThat(requests.get(0).headers().containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
        JsonNode body = objectMapper.readTree(bodies.get(0));
        assertThat(body.path("collectionName").asText()).isEqualTo("note");
        assertThat(body.path("filter").asText()).isEqualTo("id > 0");
        assertThat(body.path("limit").asInt()).isEqualTo(995);
        assertThat(body.path("offset").asInt()).isEqualTo(5);
        assertThat(body.has("dbName")).isFalse();
        assertThat(body.has("consistencyLevel")).isFalse();
    }

    @Test
    @DisplayName("Search sends one query vector with its metric and strips distance from entities")
    void shouldSearch() throws Exception {
        responseBody = "{\"code\":0,\"data\":[{\"id\":3,\"title\":\"near\",\"distance\":0.12}]}";
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);
        SearchRequest request = SearchRequest.builder()
                .collectionName("articles")
                .annsField("embedding")
                .vector(List.of(0.5f, 0.25f))
                .metricType("IP")
                .limit(4)
                .filter("views > 1")
                .outputFields(List.of("id", "title"))
                .consistencyLevel(ConsistencyLevel.BOUNDED)
                .build();

        List<SearchHit> hits = client.search(request).block();

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).distance()).isEqualTo(0.12);
        assertThat(hits.get(0).entity()).containsOnlyKeys("id", "title");
        assertThat(requests.get(0).url().getPath()).isEqualTo("/v2/vectordb/entities/search");
        JsonNode body = objectMapper.readTree(bodies.get(0));
        assertThat(body.path("data").get(0).get(1).asDouble()).isEqualTo(0.25);
        assertThat(body.path("annsField").asText()).isEqualTo("embedding");
        assertThat(body.path("searchParams").path("metricType").asText()).isEqualTo("IP");
        assertThat(body.path("limit").asInt()).isEqualTo(4);
        assertThat(body.has("offset")).isFalse();
        assertThat(body.path("consistencyLevel").asText()).isEqualTo("Bounded");
    }

    @Test
    @DisplayName("Count asks for count(*) without a limit")
    void shouldCount() throws Exception {
        responseBody = "{\"code\":0,\"data\":[{\"count(*)\":12}]}";
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);

        Long count = client.count("note", "", ConsistencyLevel.STRONG).block();

        assertThat(count).isEqualTo(12L);
        JsonNode body = objectMapper.readTree(bodies.get(0));
        assertThat(body.path("outputFields").get(0).asText()).isEqualTo("count(*)");
        assertThat(body.has("limit")).isFalse();
        assertThat(body.path("consistencyLevel").asText()).isEqualTo("Strong");
        assertThat(client.supportsCount()).isTrue();
        assertThat(client.supportsOrdering()).isFalse();
    }

    @Test
    @DisplayName("Insert sends rows and reads generated keys")
    void shouldInsert() throws Exception {
        responseBody = "{\"code\":0,\"data\":{\"insertCount\":2,\"insertIds\":[5,6]}}";
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", "a");

        InsertResult result = client.insert("tag", List.of(row, Map.of("name", "b"))).block();

        assertThat(result.insertCount()).isEqualTo(2);
        assertThat(result.primaryKeys()).containsExactly(5L, 6L);
        JsonNode body = objectMapper.readTree(bodies.get(0));
        assertThat(body.path("data")).hasSize(2);
        assertThat(body.path("data").get(1).path("name").asText()).isEqualTo("b");
    }

    @Test
    @DisplayName("Delete reports -1 when the store omits the count")
    void shouldDelete() throws Exception {
        responseBody = "{\"code\":0,\"data\":{}}";
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);

        Long deleted = client.delete("note", "id == 1").block();

        assertThat(deleted).isEqualTo(-1L);
        assertThat(objectMapper.readTree(bodies.get(0)).path("filter").asText()).isEqualTo("id == 1");
    }

    @Test
    @DisplayName("Token and database are passed through")
    void shouldSendCredentials() throws Exception {
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), "root:Milvus", "docs");

        client.delete("note", "id == 1").block();

        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer root:Milvus");
        assertThat(objectMapper.readTree(bodies.get(0)).path("dbName").asText()).isEqualTo("docs");
    }

    @Test
    @DisplayName("Non-zero response codes become VectorStoreException")
    void shouldMapErrorCode() {
        responseBody = "{\"code\":100,\"message\":\"collection not found[collection=nope]\"}";
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);

        assertThatThrownBy(() -> client.query(QueryRequest.all("nope")).block())
                .isInstanceOf(VectorStoreException.class)
                .hasMessageContaining("collection not found")
                .extracting("code").isEqualTo(100);
    }

    @Test
    @DisplayName("HTTP failures become VectorStoreException")
    void shouldMapHttpFailure() {
        status = HttpStatus.SERVICE_UNAVAILABLE;
        responseBody = "unavailable";
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);

        assertThatThrownBy(() -> client.delete("note", "id == 1").block())
                .isInstanceOf(VectorStoreException.class)
                .extracting("code").isEqualTo(VectorStoreException.TRANSPORT_ERROR);
    }

    @Test
    @DisplayName("Ordered queries are refused without a request")
    void shouldRefuseOrderedQuery() {
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);
        QueryRequest ordered = new QueryRequest("note", "", List.of(), null, null, SortKey.parse("-id"), null);

        assertThatThrownBy(() -> client.query(ordered).block()).isInstanceOf(VectorStoreException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    @DisplayName("Queries reaching past the window fail before any request")
    void shouldRefuseQueryBeyondWindow() {
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);
        QueryRequest pastWindow = new QueryRequest("note", "", List.of("id"), null, 1000, null, null);
        QueryRequest overlapping = new QueryRequest("note", "", List.of("id"), 10, 995, null, null);

        assertThatThrownBy(() -> client.query(pastWindow).block())
                .isInstanceOf(QueryConfigException.class)
                .hasMessageContaining("1000");
        assertThatThrownBy(() -> client.query(overlapping).block()).isInstanceOf(QueryConfigException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    @DisplayName("An explicit limit inside the window is sent as given")
    void shouldKeepExplicitLimit() throws Exception {
        MilvusRestClient client = factory.create(URI.create("http://milvus:19530"), null, null);

        client.query(new QueryRequest("note", "", List.of("id"), 20, 980, null, ConsistencyLevel.STRONG)).block();

        JsonNode body = objectMapper.readTree(bodies.get(0));
        assertThat(body.path("limit").asInt()).isEqualTo(20);
        assertThat(body.path("offset").asInt()).isEqualTo(980);
        assertThat(body.path("consistencyLevel").asText()).isEqualTo("Strong");
    }
}
