package io.torotator.util;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * FreeMarker templates for the generated collaborator configs, loaded from {@code /templates} on the
 * classpath. Numbers must be interpolated with {@code ?c}; ports are never locale-formatted.
 */
public final class ConfigTemplates {
    private static final Configuration FTL = createConfiguration();

    private ConfigTemplates() {
    }

    public static String render(String name, Map<String, ?> model) throws IOException, TemplateException {
        Template template = FTL.getTemplate(name);
        StringWriter out = new StringWriter();
        template.process(model, out);
        return out.toString();
    }

    private static Configuration createConfiguration() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(ConfigTemplates.class, "/templates");
        cfg.setDefaultEncoding(StandardCharsets.UTF_8.name());
        cfg.setLocale(Locale.ROOT);
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }
}
