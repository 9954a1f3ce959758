package org.apirepository.rest;

import freemarker.template.TemplateModel;
import org.apirepository.iterator.PageFetcher;
import org.apirepository.model.ApiEndpointConfig;
import org.apirepository.rest.json.JsonPageReader;
import org.apirepository.rest.service.TemplateContextBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetches one page of records from a REST endpoint and maps them to the repository's record type.
 */
public class RestPageFetcher<T> implements PageFetcher<T> {

    private final RestEndpointClient client;
    private final RecordMapper<T> mapper;
    private final TemplateContextBuilder templateContextBuilder = new TemplateContextBuilder();
    private final JsonPageReader pageReader;

    public RestPageFetcher(RestEndpointClient client, RecordMapper<T> mapper) {
        this.client = client;
        this.mapper = mapper;
        this.pageReader = new JsonPageReader(client.getConfig().getItemsPath());
    }

    @Override
    public List<T> fetch(int offset, int pageSize) {
        ApiEndpointConfig config = client.getConfig();
        Map<String, TemplateModel> context = templateContextBuilder.pageContext(config, offset, pageSize);
        String response = client.send(config.getMethod(), config.getUrlTemplate(), config.getBodyTemplate(), context);

        List<T> page = new ArrayList<>();
        for (JsonRecord record : pageReader.read(response)) {
            page.add(mapper.fromJson(record));
        }
        return page;
    }
}
