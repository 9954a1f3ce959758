package org.apirepository.rest.service;

import freemarker.template.SimpleNumber;
import freemarker.template.SimpleScalar;
import freemarker.template.TemplateModel;
import org.apirepository.freemarker.FreeMarkerEngine;
import org.apirepository.freemarker.exception.ConvertException;
import org.apirepository.model.ApiEndpointConfig;
import org.apirepository.repository.SearchParams;
import org.apirepository.rest.JsonRecord;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds FreeMarker template context for REST API request rendering.
 *
 * <p>Context variables:</p>
 * <ul>
 *   <li>Paging: {@code offset}, {@code limit}, {@code pageStart}, {@code page}</li>
 *   <li>Lookup: every search parameter by name, and all of them under {@code params}</li>
 *   <li>Mutations: the record under {@code record}, its JSON text as {@code recordJson}</li>
 * </ul>
 *
 * <p><b>Example context for the third page of size 50:</b></p>
 * <pre>{@code
 * {
 *   "offset": 100,
 *   "limit": 50,
 *   "pageStart": 1,
 *   "page": 3
 * }
 * }</pre>
 */
public class TemplateContextBuilder {

    /**
     * Context for fetching one page.
     *
     * @param config   endpoint configuration
     * @param offset   number of records already received
     * @param pageSize number of records requested
     * @return template context
     */
    public Map<String, TemplateModel> pageContext(ApiEndpointConfig config, int offset, int pageSize) {
        Map<String, TemplateModel> context = new HashMap<>();
        int pageIndex = pageSize > 0 ? offset / pageSize : 0;
        context.put("offset", new SimpleNumber(offset));
        context.put("limit", new SimpleNumber(pageSize));
        context.put("pageStart", new SimpleNumber(config.getPageStart()));
        context.put("page", new SimpleNumber(config.getPageStart() + pageIndex));
        return context;
    }

    /**
     * Context for a direct single-record lookup.
     *
     * @throws ConvertException if a parameter value cannot be wrapped
     */
    public Map<String, TemplateModel> searchContext(SearchParams searchParams) throws ConvertException {
        Map<String, TemplateModel> context = new HashMap<>();
        for (Map.Entry<String, Object> entry : searchParams.asMap().entrySet()) {
            Object value = entry.getValue();
            context.put(entry.getKey(), value == null ? new SimpleScalar("") : FreeMarkerEngine.convert(value));
        }
        context.put("params", FreeMarkerEngine.convert(searchParams.asMap()));
        return context;
    }

    /**
     * Context for updating or deleting a record.
     *
     * @throws ConvertException if the record cannot be wrapped
     */
    public Map<String, TemplateModel> recordContext(JsonRecord record) throws ConvertException {
        Map<String, TemplateModel> context = new HashMap<>();
        context.put("record", FreeMarkerEngine.convert(record.asMap()));
        context.put("recordJson", new SimpleScalar(record.toJson()));
        return context;
    }
}
