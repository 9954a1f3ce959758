package org.apirepository.freemarker;

import freemarker.core.TemplateNumberFormatFactory;
import freemarker.template.*;
import lombok.Getter;
import org.apirepository.freemarker.exception.ConvertException;
import org.apirepository.freemarker.exception.FreeMarkerException;
import org.apirepository.freemarker.exception.FreeMarkerFormatException;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * Application-wide singleton rendering request templates (URLs, headers, bodies).
 * <p>
 * - Numbers render without locale grouping, booleans as {@code true}/{@code false}.
 * - Template errors are rethrown, never written into the output.
 * </p>
 */
public class FreeMarkerEngine {

    /** Singleton instance of engine for global access. */
    @Getter
    private static final FreeMarkerEngine instance = new FreeMarkerEngine();

    /** Freemarker configuration: thread-safe, global per application. */
    private static final Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);

    static {
        cfg.setBooleanFormat("c");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);

        Map<String, TemplateNumberFormatFactory> numberFormats = new HashMap<>();
        numberFormats.put("plain", PlainNumberFormatFactory.INSTANCE);
        cfg.setCustomNumberFormats(numberFormats);
        cfg.setNumberFormat("@plain");
    }

    private FreeMarkerEngine() {
    }

    /**
     * Renders a template string with the given variable bindings.
     *
     * @param template  The template text.
     * @param variables Bindings (variable name -> TemplateModel).
     * @return The rendered result, trimmed.
     * @throws FreeMarkerFormatException If the template fails to render.
     */
    public String process(String template, Map<String, TemplateModel> variables)
            throws FreeMarkerFormatException {
        StringWriter stringWriter = new StringWriter();
        try {
            getTemplate(template).process(variables, stringWriter);
        } catch (IOException | TemplateException ex) {
            throw new FreeMarkerFormatException(ex.getMessage(), ex);
        }
        return stringWriter.toString().trim();
    }

    /**
     * Compiles a template from the provided string.
     *
     * @throws FreeMarkerException If the template cannot be parsed.
     */
    public Template getTemplate(String templateText) {
        try {
            return new Template("request", templateText, cfg);
        } catch (IOException e) {
            throw new FreeMarkerException(e.getMessage(), e);
        }
    }

    /**
     * Wraps a Java object (primitive, collection, map, bean) as a TemplateModel.
     *
     * @throws ConvertException If wrapping fails.
     */
    public static TemplateModel convert(Object value) throws ConvertException {
        try {
            return cfg.getObjectWrapper().wrap(value);
        } catch (TemplateModelException e) {
            throw ConvertException.buildConvertException(e);
        }
    }

}
