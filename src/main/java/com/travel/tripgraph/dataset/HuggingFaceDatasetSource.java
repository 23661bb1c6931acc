package com.travel.tripgraph.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.core.type.TypeReference;
import com.travel.tripgraph.config.DatasetProperties;
import com.travel.tripgraph.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streams the TravelPlanner corpus from the Hugging Face datasets-server "rows" API.
 * Pages are fetched lazily as the stream is consumed; the pass ends after the last reported row.
 */
@Component
@Slf4j
public class HuggingFaceDatasetSource implements DatasetSource {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final DatasetProperties.HuggingFace properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    public HuggingFaceDatasetSource(DatasetProperties datasetProperties, ObjectMapper objectMapper) {
        this.properties = datasetProperties.getHuggingFace();
        this.objectMapper = objectMapper;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(properties.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public Stream<Map<String, Object>> open() {
        log.info("Streaming dataset {} ({}/{}) from {}",
                properties.getDataset(), properties.getConfig(), properties.getSplit(), properties.getBaseUrl());
        RowPager pager = new RowPager();
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(pager, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public String describe() {
        return "huggingface:" + properties.getDataset() + "/" + properties.getConfig() + "/" + properties.getSplit();
    }

    JsonNode fetchPage(long offset) {
        HttpUrl baseUrl = HttpUrl.parse(properties.getBaseUrl());
        if (baseUrl == null) {
            throw new SourceUnavailableException("Invalid dataset base URL: " + properties.getBaseUrl());
        }
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments("rows")
                .addQueryParameter("dataset", properties.getDataset())
                .addQueryParameter("config", properties.getConfig())
                .addQueryParameter("split", properties.getSplit())
                .addQueryParameter("offset", String.valueOf(offset))
                .addQueryParameter("length", String.valueOf(properties.getPageSize()))
                .build();

        Request request = new Request.Builder().url(url).get().build();
        log.debug("Fetching dataset rows: {}", url);

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = body != null ? body.string() : "No error body";
                throw new SourceUnavailableException("Dataset rows request failed: "
                        + response.code() + " - " + errorBody);
            }
            if (body == null) {
                throw new SourceUnavailableException("Dataset rows response had no body");
            }
            return objectMapper.readTree(body.string());
        } catch (IOException e) {
            throw new SourceUnavailableException("Dataset endpoint unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * Pulls one page at a time and hands out its rows
     */
    private final class RowPager implements Iterator<Map<String, Object>> {

        private final Deque<Map<String, Object>> buffer = new ArrayDeque<>();
        private long offset = 0;
        private Long totalRows;
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                fill();
            }
            return !buffer.isEmpty();
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void fill() {
            if (totalRows != null && offset >= totalRows) {
                exhausted = true;
                return;
            }
            JsonNode page = fetchPage(offset);
            if (page.hasNonNull("num_rows_total")) {
                totalRows = page.get("num_rows_total").asLong();
            }
            JsonNode rows = page.path("rows");
            if (!rows.isArray() || rows.isEmpty()) {
                exhausted = true;
                return;
            }
            for (JsonNode row : rows) {
                JsonNode record = row.path("row");
                if (record.isObject()) {
                    buffer.add(objectMapper.convertValue(record, RECORD_TYPE));
                }
            }
            offset += rows.size();
            if (rows.size() < properties.getPageSize()) {
                exhausted = true;
            }
        }
    }
}
