package com.sitebuild.groupby.expression;

import freemarker.core.Environment;
import freemarker.template.AdapterTemplateModel;
import freemarker.template.Configuration;
import freemarker.template.DefaultObjectWrapper;
import freemarker.template.ObjectWrapper;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.TemplateHashModel;
import freemarker.template.TemplateModel;
import freemarker.template.TemplateModelException;
import freemarker.template.Version;
import freemarker.template.utility.DeepUnwrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates config expressions with FreeMarker.
 *
 * Text containing {@code ${...}} or a directive is rendered and returns a
 * string. Anything else is a single FreeMarker expression, e.g.
 * {@code this.key?upper_case} or {@code item.featured}, and returns the
 * unwrapped value; an undefined result is {@code null}.
 *
 * Groups, pages and records are read through {@link PropertySource}, so
 * {@code this.key_obj} and {@code record.url_path} use their property names.
 * Numbers and booleans render in computer format regardless of locale.
 */
public class FreemarkerExpressionEvaluator implements ExpressionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(FreemarkerExpressionEvaluator.class);

    private static final Version VERSION = Configuration.VERSION_2_3_32;
    private static final String RESULT = "groupby_result";
    private static final String UNDEFINED = "groupby_undefined";
    private static final Object UNDEFINED_MARKER = new Object() {
        @Override
        public String toString() {
            return UNDEFINED;
        }
    };

    private final Configuration freemarkerConfig;

    public FreemarkerExpressionEvaluator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private static Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(VERSION);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setLocale(Locale.ROOT);
        cfg.setNumberFormat("computer");
        cfg.setBooleanFormat("c");
        cfg.setObjectWrapper(new PropertyObjectWrapper(VERSION));
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    @Override
    public Object evaluate(String expression, ExpressionContext context) {
        if (expression == null) {
            return null;
        }
        Map<String, Object> model = new LinkedHashMap<>(context.getVariables());
        if (isTemplate(expression)) {
            return render(expression, model);
        }
        model.put(UNDEFINED, UNDEFINED_MARKER);
        String source = "<#assign " + RESULT + " = (" + expression.trim() + ")!" + UNDEFINED + ">";
        try {
            Template template = new Template("expression", new StringReader(source), freemarkerConfig);
            Environment env = template.createProcessingEnvironment(model, new StringWriter());
            env.process();
            Object value = DeepUnwrap.unwrap(env.getMainNamespace().get(RESULT));
            return value == UNDEFINED_MARKER ? null : value;
        } catch (IOException | TemplateException e) {
            log.debug("FreeMarker failed on expression {}", expression, e);
            throw new IllegalArgumentException("Invalid expression: " + expression + " (" + e.getMessage() + ")", e);
        }
    }

    private String render(String expression, Map<String, Object> model) {
        try {
            Template template = new Template("template", new StringReader(expression), freemarkerConfig);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            log.debug("FreeMarker failed on template {}", expression, e);
            throw new IllegalArgumentException("Invalid template: " + expression + " (" + e.getMessage() + ")", e);
        }
    }

    private static boolean isTemplate(String expression) {
        return expression.contains("${") || expression.contains("<#");
    }

    /**
     * Wraps groups and records so templates read them through their property
     * names instead of bean getters.
     */
    private static final class PropertyObjectWrapper extends DefaultObjectWrapper {

        PropertyObjectWrapper(Version version) {
            super(version);
        }

        @Override
        protected TemplateModel handleUnknownType(Object obj) throws TemplateModelException {
            if (obj instanceof PropertySource source) {
                return new PropertyModel(source, this);
            }
            return super.handleUnknownType(obj);
        }
    }

    private static final class PropertyModel implements TemplateHashModel, AdapterTemplateModel {

        private final PropertySource target;
        private final ObjectWrapper wrapper;

        PropertyModel(PropertySource target, ObjectWrapper wrapper) {
            this.target = target;
            this.wrapper = wrapper;
        }

        @Override
        public TemplateModel get(String key) throws TemplateModelException {
            try {
                return wrapper.wrap(target.getProperty(key));
            } catch (IllegalArgumentException e) {
                throw new TemplateModelException("Cannot read " + key + " of " + target, e);
            }
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public Object getAdaptedObject(Class<?> hint) {
            return target;
        }
    }
}
