package com.thriftgen.generator.template;

import java.io.IOException;
import java.util.Map;

import freemarker.core.Environment;
import freemarker.template.TemplateDirectiveBody;
import freemarker.template.TemplateDirectiveModel;
import freemarker.template.TemplateException;
import freemarker.template.TemplateModel;
import freemarker.template.TemplateModelException;

/**
 * A compiled fragment stored in a dictionary, called from another fragment as
 * {@code <@key model=item/>}. The partial renders {@code item} with the caller's data
 * model behind it.
 */
final class PartialDirective implements TemplateDirectiveModel {

    static final String MODEL_PARAM = "model";

    private final CompiledFragment fragment;

    PartialDirective(CompiledFragment fragment) {
        this.fragment = fragment;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public void execute(Environment env, Map params, TemplateModel[] loopVars, TemplateDirectiveBody body)
            throws TemplateException, IOException {
        Object model = params.get(MODEL_PARAM);
        if (params.size() != 1 || !(model instanceof DictionaryModel scope)) {
            throw new TemplateModelException("Partial '" + fragment.getName()
                    + "' takes exactly one parameter, " + MODEL_PARAM + "=<dictionary>");
        }
        if (body != null) {
            throw new TemplateModelException("Partial '" + fragment.getName() + "' takes no nested content");
        }
        fragment.renderTo(new DictionaryModel(scope.dictionary(), env.getDataModel()), env.getOut());
    }
}
