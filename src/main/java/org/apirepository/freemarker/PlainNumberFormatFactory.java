package org.apirepository.freemarker;

import freemarker.core.*;
import freemarker.template.TemplateModelException;
import freemarker.template.TemplateNumberModel;

import java.util.Locale;

/**
 * Number format that prints {@link Number#toString()}, with no grouping separators.
 * <p>
 * Paging values end up in URLs and request bodies, where {@code offset=1,000} would break the request.
 * </p>
 */
public class PlainNumberFormatFactory extends TemplateNumberFormatFactory {

    public static final PlainNumberFormatFactory INSTANCE = new PlainNumberFormatFactory();

    private PlainNumberFormatFactory() {
    }

    @Override
    public TemplateNumberFormat get(String params, Locale locale, Environment env)
            throws InvalidFormatParametersException {
        TemplateFormatUtil.checkHasNoParameters(params);
        return PlainNumberFormat.INSTANCE;
    }

    private static class PlainNumberFormat extends TemplateNumberFormat {

        private static final PlainNumberFormat INSTANCE = new PlainNumberFormat();

        private PlainNumberFormat() { }

        @Override
        public String formatToPlainText(TemplateNumberModel numberModel)
                throws UnformattableValueException, TemplateModelException {
            return TemplateFormatUtil.getNonNullNumber(numberModel).toString();
        }

        @Override
        public boolean isLocaleBound() {
            return false;
        }

        @Override
        public String getDescription() {
            return "plain number";
        }
    }
}
