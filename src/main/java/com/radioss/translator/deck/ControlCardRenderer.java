package com.radioss.translator.deck;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import com.radioss.translator.deck.config.ControlSettings;
import com.radioss.translator.exception.TranslationException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders run and output control cards from the templates under {@code /templates}.
 * Values are formatted before they reach the template so column layout stays in {@link CardFormat}.
 */
public class ControlCardRenderer {

    static final String CONTROL_TEMPLATE = "control-cards.ftl";
    static final String ENGINE_TEMPLATE = "engine.ftl";

    private final Configuration freemarkerConfig;

    public ControlCardRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Control block written into the starter.
     */
    public String renderControlCards(ControlSettings settings, String runName) {
        return render(CONTROL_TEMPLATE, settings, runName);
    }

    /**
     * Complete engine input file.
     */
    public String renderEngine(ControlSettings settings, String runName) {
        return render(ENGINE_TEMPLATE, settings, runName);
    }

    private String render(String templateName, ControlSettings settings, String runName) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(dataModel(settings, runName), out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new TranslationException("Failed to render " + templateName + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> dataModel(ControlSettings settings, String runName) {
        Map<String, Object> model = new HashMap<>();
        model.put("runName", runName);
        model.put("endTimeRow", CardFormat.reals(settings.getEndTime() != null ? settings.getEndTime() : 0.0));

        if (settings.isStopCard()) {
            model.put("stopRow", CardFormat.reals(0.0, 0.0, 0.0) + CardFormat.ints(1, 1, 0));
        }
        if (settings.getHistoryDt() != null) {
            model.put("historyRow", CardFormat.reals(settings.getHistoryDt()));
        }
        if (settings.getAnimDt() != null) {
            double start = settings.getAnimStart() != null ? settings.getAnimStart() : 0.0;
            model.put("animRow", CardFormat.reals(start, settings.getAnimDt()));
        }
        if (settings.getDtScale() != null) {
            double min = settings.getDtMin() != null ? settings.getDtMin() : 0.0;
            model.put("dtRow", CardFormat.reals(settings.getDtScale(), min));
        }
        if (settings.getPrintFrequency() != null) {
            int lines = settings.getPrintLines() != null ? settings.getPrintLines() : 1;
            model.put("printPath", settings.getPrintFrequency() + "/" + lines);
        }
        if (settings.getRestartFrequency() != null) {
            model.put("restartFrequency", String.valueOf(settings.getRestartFrequency()));
        }
        if (settings.getH3dDt() != null) {
            model.put("h3dRow", CardFormat.reals(0.0, settings.getH3dDt()));
        }
        if (settings.getAdyrelStart() != null || settings.getAdyrelStop() != null) {
            model.put("adyrelRow", CardFormat.reals(
                    settings.getAdyrelStart() != null ? settings.getAdyrelStart() : 0.0,
                    settings.getAdyrelStop() != null ? settings.getAdyrelStop() : 0.0));
        }
        return model;
    }
}
