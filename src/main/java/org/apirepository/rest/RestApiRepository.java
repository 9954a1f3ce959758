package org.apirepository.rest;

import freemarker.template.TemplateModel;
import org.apirepository.model.ApiEndpointConfig;
import org.apirepository.repository.ApiRepositoryBase;
import org.apirepository.repository.SearchParams;
import org.apirepository.repository.exception.ApiOperationNotSupportedException;
import org.apirepository.rest.exception.ApiRequestException;
import org.apirepository.rest.json.JsonPageReader;
import org.apirepository.rest.service.TemplateContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Repository over a paginated JSON REST endpoint described by an {@link ApiEndpointConfig}.
 *
 * <p><b>Lookup:</b> {@link #get(SearchParams)} calls {@code itemUrlTemplate} when configured
 * (search parameters are template variables; a 404 means "not found"). Without it, the lookup
 * falls back to {@link #find} with a predicate matching every parameter key, read as a JSON path,
 * against the record.</p>
 *
 * <p><b>Mutations:</b> {@link #update} needs {@code updateUrlTemplate}, {@link #delete} and
 * {@link #deleteAll} need {@code deleteUrlTemplate}; otherwise they throw
 * {@link ApiOperationNotSupportedException}. Request failures propagate as {@link ApiRequestException}.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ApiEndpointConfig config = new ApiEndpointConfig();
 * config.setAddresses("https://api.example.com");
 * config.setUrlTemplate("/users?offset=${offset}&limit=${limit}");
 * config.setItemsPath("$.data");
 * RestApiRepository<JsonRecord> users = RestApiRepository.create(config, JsonRecordMapper.INSTANCE);
 * JsonRecord alice = users.find(u -> "alice".equals(u.read("login")));
 * }</pre>
 */
public class RestApiRepository<T> extends ApiRepositoryBase<T> {

    private static final Logger logger = LoggerFactory.getLogger(RestApiRepository.class);

    private final RestEndpointClient client;
    private final RecordMapper<T> mapper;
    private final TemplateContextBuilder templateContextBuilder = new TemplateContextBuilder();
    private final int maxPageSize;
    private int pageSize;

    public RestApiRepository(RestEndpointClient client, RecordMapper<T> mapper) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.maxPageSize = client.getConfig().getMaxPageSize();
        this.pageSize = client.getConfig().getPageSize();
    }

    /**
     * Creates a repository for the endpoint with a {@link RestApiIterable} already attached.
     * The iterable requests its first page with the repository's current page size.
     */
    public static <T> RestApiRepository<T> create(ApiEndpointConfig config, RecordMapper<T> mapper) {
        RestEndpointClient client = new RestEndpointClient(config);
        RestApiRepository<T> repository = new RestApiRepository<>(client, mapper);
        repository.attachDataSource(new RestApiIterable<>(new RestPageFetcher<>(client, mapper), repository::getPageSize));
        return repository;
    }

    @Override
    public int getMaxPageSize() {
        return maxPageSize;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public void setPageSize(int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        if (maxPageSize >= 1 && pageSize > maxPageSize) {
            throw new IllegalArgumentException("pageSize " + pageSize + " exceeds maxPageSize " + maxPageSize);
        }
        this.pageSize = pageSize;
    }

    @Override
    public T get(SearchParams searchParams) {
        if (searchParams == null) {
            throw new IllegalArgumentException("searchParams must not be null");
        }
        ApiEndpointConfig config = client.getConfig();
        if (config.getItemUrlTemplate() == null) {
            return findBySearchParams(searchParams, this::matching);
        }

        Map<String, TemplateModel> context = templateContextBuilder.searchContext(searchParams);
        String response;
        try {
            response = client.send("GET", config.getItemUrlTemplate(), null, context);
        } catch (ApiRequestException e) {
            if (e.getStatusCode() == 404) {
                logger.debug("No record found for {}", searchParams);
                return null;
            }
            throw e;
        }
        JsonRecord record = JsonPageReader.readSingle(response);
        return record == null ? null : mapper.fromJson(record);
    }

    @Override
    public void update(T recordToUpdate) {
        if (recordToUpdate == null) {
            throw new IllegalArgumentException("recordToUpdate must not be null");
        }
        ApiEndpointConfig config = client.getConfig();
        if (config.getUpdateUrlTemplate() == null) {
            throw ApiOperationNotSupportedException.buildApiOperationNotSupportedException("update", config.getAddresses());
        }
        String bodyTemplate = config.getUpdateBodyTemplate() != null ? config.getUpdateBodyTemplate() : "${recordJson}";
        client.send(config.getUpdateMethod(), config.getUpdateUrlTemplate(), bodyTemplate,
                templateContextBuilder.recordContext(mapper.toJson(recordToUpdate)));
    }

    @Override
    public void delete(T recordToDelete) {
        if (recordToDelete == null) {
            throw new IllegalArgumentException("recordToDelete must not be null");
        }
        ApiEndpointConfig config = client.getConfig();
        if (config.getDeleteUrlTemplate() == null) {
            throw ApiOperationNotSupportedException.buildApiOperationNotSupportedException("delete", config.getAddresses());
        }
        client.send("DELETE", config.getDeleteUrlTemplate(), null,
                templateContextBuilder.recordContext(mapper.toJson(recordToDelete)));
    }

    /**
     * Deletes every record matching {@code predicate}. Matching records are collected first,
     * then deleted one request at a time. A failure while reading the records propagates
     * and nothing is deleted.
     */
    @Override
    public void deleteAll(Predicate<T> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate must not be null");
        }
        if (client.getConfig().getDeleteUrlTemplate() == null) {
            throw ApiOperationNotSupportedException.buildApiOperationNotSupportedException("deleteAll", client.getConfig().getAddresses());
        }
        List<T> matches = collectAll().stream().filter(predicate).collect(Collectors.toList());
        for (T record : matches) {
            delete(record);
        }
        logger.info("Deleted {} records from {}", matches.size(), client.getConfig().getAddresses());
    }

    private Predicate<T> matching(SearchParams searchParams) {
        return record -> {
            JsonRecord json = mapper.toJson(record);
            for (Map.Entry<String, Object> entry : searchParams.asMap().entrySet()) {
                if (!sameValue(json.read(entry.getKey()), entry.getValue())) {
                    return false;
                }
            }
            return true;
        };
    }

    private static boolean sameValue(Object actual, Object expected) {
        if (Objects.equals(actual, expected)) {
            return true;
        }
        // JSON numbers come back as Integer, Long or Double depending on magnitude
        return actual != null && expected != null && actual.toString().equals(expected.toString());
    }
}
