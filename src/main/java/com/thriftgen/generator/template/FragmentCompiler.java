package com.thriftgen.generator.template;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.template.exception.TemplateSyntaxException;

import freemarker.core.ParseException;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateExceptionHandler;

/**
 * Compiles FreeMarker fragment source into a {@link CompiledFragment}.
 *
 * <p>Fragments see one {@link Dictionary} as their data model: scalars interpolate with
 * {@code ${key}}, flags gate {@code <#if>}, sequences drive {@code <#list>} (with
 * {@code <#sep>} for separators) and partials are called as {@code <@key model=item/>}.
 */
public class FragmentCompiler {
    private static final Logger log = LoggerFactory.getLogger(FragmentCompiler.class);

    private final Configuration freemarkerConfig;

    public FragmentCompiler() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private static Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        // generated Scala may contain #{ ... }, only ${ ... } interpolates
        cfg.setInterpolationSyntax(Configuration.DOLLAR_INTERPOLATION_SYNTAX);
        return cfg;
    }

    /**
     * Compile {@code source} into a fragment named {@code fragmentName}.
     *
     * @throws TemplateSyntaxException when the source is not valid FreeMarker
     */
    public CompiledFragment compile(String fragmentName, String source) {
        log.debug("Compiling fragment '{}'", fragmentName);
        try {
            Template template = new Template(fragmentName, new StringReader(source), freemarkerConfig);
            return new CompiledFragment(fragmentName, template);
        } catch (ParseException e) {
            throw new TemplateSyntaxException(fragmentName, e.getLineNumber(), e.getEditorMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read fragment '" + fragmentName + "'", e);
        }
    }
}
