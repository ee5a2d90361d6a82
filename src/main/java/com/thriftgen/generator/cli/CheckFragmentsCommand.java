package com.thriftgen.generator.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.cli.exception.OptionsValidationException;
import com.thriftgen.generator.codegen.GeneratorConfig;
import com.thriftgen.generator.codegen.ScalaGenerator;
import com.thriftgen.generator.codegen.ServiceOption;
import com.thriftgen.generator.model.BaseType;
import com.thriftgen.generator.model.ConstDef;
import com.thriftgen.generator.model.Document;
import com.thriftgen.generator.model.EnumDef;
import com.thriftgen.generator.model.EnumType;
import com.thriftgen.generator.model.EnumValue;
import com.thriftgen.generator.model.Field;
import com.thriftgen.generator.model.FunctionDef;
import com.thriftgen.generator.model.IntConstant;
import com.thriftgen.generator.model.ListType;
import com.thriftgen.generator.model.MapType;
import com.thriftgen.generator.model.Namespace;
import com.thriftgen.generator.model.Requiredness;
import com.thriftgen.generator.model.ServiceDef;
import com.thriftgen.generator.model.StringConstant;
import com.thriftgen.generator.model.StructDef;
import com.thriftgen.generator.model.StructKind;
import com.thriftgen.generator.model.StructType;
import com.thriftgen.generator.template.ClasspathFragmentLoader;
import com.thriftgen.generator.template.DirectoryFragmentLoader;
import com.thriftgen.generator.template.FragmentCompiler;
import com.thriftgen.generator.template.FragmentLoader;
import com.thriftgen.generator.template.FragmentRegistry;
import com.thriftgen.generator.template.exception.TemplateBindingException;
import com.thriftgen.generator.template.exception.TemplateSyntaxException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Compiles every generator fragment and, when they all compile, renders a sample
 * document through them so binding errors show up before a real build does.
 */
@Command(
        name = "check-fragments",
        mixinStandardHelpOptions = true,
        version = "thrift-scala-generator 1.0.0",
        description = "Compiles the Scala generator fragments and renders a sample schema through them."
)
public class CheckFragmentsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckFragmentsCommand.class);

    @Option(names = {"--template-dir", "-d"}, description = "Directory holding <prefix>/<name>.ftl files (defaults to the bundled fragments)")
    private Path templateDir;

    @Option(names = {"--prefix", "-p"}, defaultValue = GeneratorConfig.DEFAULT_TEMPLATE_PREFIX, description = "Fragment prefix (default: ${DEFAULT-VALUE})")
    private String prefix;

    @Option(names = {"--skip-render"}, description = "Only check syntax; do not render the sample schema")
    private boolean skipRender;

    @Override
    public Integer call() {
        try {
            validateOptions();

            FragmentLoader loader = templateDir != null
                    ? new DirectoryFragmentLoader(templateDir)
                    : new ClasspathFragmentLoader();
            List<String> names = fragmentNames(loader);

            log.info("Checking {} fragments under {}", names.size(), describeSource());
            List<String> errors = compileAll(loader, names);
            if (!errors.isEmpty()) {
                errors.forEach(e -> log.error("  {}", e));
                log.error("{} fragment error(s)", errors.size());
                return 1;
            }

            if (!skipRender) {
                GeneratorConfig config = GeneratorConfig.builder()
                        .templatePrefix(prefix)
                        .serviceOptions(EnumSet.allOf(ServiceOption.class))
                        .build();
                FragmentRegistry registry = ScalaGenerator.loadFragments(loader, config);
                String output = new ScalaGenerator(registry, config).generate(sampleDocument());
                log.info("Sample schema rendered: {} lines", output.lines().count());
            }

            log.info("All fragments OK");
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (TemplateBindingException e) {
            log.error("Sample render failed: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to read fragments", e);
            return 1;
        }
    }

    private void validateOptions() {
        List<String> errors = new ArrayList<>();
        if (templateDir != null && !Files.isDirectory(templateDir)) {
            errors.add("Template directory does not exist or is not a directory: " + templateDir);
        }
        if (prefix == null) {
            errors.add("Prefix must not be null (--prefix / -p).");
        }
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
    }

    /**
     * The generator's fragments, plus any extra fragment files found in the directory.
     */
    private List<String> fragmentNames(FragmentLoader loader) throws IOException {
        Set<String> names = new LinkedHashSet<>(ScalaGenerator.FRAGMENT_NAMES);
        if (loader instanceof DirectoryFragmentLoader directory) {
            try {
                names.addAll(directory.fragmentNames(prefix));
            } catch (NoSuchFileException e) {
                log.warn("No fragment directory for prefix {}", prefix);
            }
        }
        return new ArrayList<>(names);
    }

    private List<String> compileAll(FragmentLoader loader, List<String> names) throws IOException {
        FragmentCompiler compiler = new FragmentCompiler();
        List<String> errors = new ArrayList<>();
        for (String name : names) {
            try {
                compiler.compile(name, loader.load(prefix, name));
                log.info("  OK {}", name);
            } catch (NoSuchFileException e) {
                errors.add("Missing fragment '" + name + "': " + e.getMessage());
            } catch (TemplateSyntaxException e) {
                errors.add(e.getMessage());
            }
        }
        return errors;
    }

    private String describeSource() {
        return templateDir != null ? templateDir.resolve(prefix.replaceAll("^/+", "")).toString() : "classpath:" + prefix;
    }

    static Document sampleDocument() {
        EnumDef status = EnumDef.builder()
                .name("Status")
                .value(new EnumValue("Active", 1))
                .value(new EnumValue("Retired", 2))
                .build();
        StructDef user = StructDef.builder()
                .name("User")
                .field(Field.builder().id(1).name("user_id").type(BaseType.I64).requiredness(Requiredness.REQUIRED).build())
                .field(Field.builder().id(2).name("display_name").type(BaseType.STRING).build())
                .field(Field.builder().id(3).name("status").type(new EnumType("Status")).build())
                .field(Field.builder().id(4).name("tags").type(new ListType(BaseType.STRING))
                        .requiredness(Requiredness.OPTIONAL).build())
                .field(Field.builder().id(5).name("scores").type(new MapType(BaseType.STRING, BaseType.DOUBLE)).build())
                .build();
        StructDef notFound = StructDef.builder()
                .name("NotFound")
                .kind(StructKind.EXCEPTION)
                .field(Field.builder().id(1).name("message").type(BaseType.STRING).build())
                .build();
        ServiceDef service = ServiceDef.builder()
                .name("UserService")
                .function(FunctionDef.builder()
                        .name("get_user")
                        .returnType(new StructType("User"))
                        .arg(Field.builder().id(1).name("user_id").type(BaseType.I64).build())
                        .throwsField(Field.builder().id(1).name("not_found").type(new StructType("NotFound")).build())
                        .build())
                .function(FunctionDef.builder()
                        .name("ping")
                        .oneway(true)
                        .build())
                .build();
        return Document.builder()
                .header(new Namespace("scala", "com.example.users"))
                .constant(new ConstDef("MaxUsers", BaseType.I32, new IntConstant(100)))
                .constant(new ConstDef("Greeting", BaseType.STRING, new StringConstant("hello")))
                .enumDef(status)
                .struct(user)
                .struct(notFound)
                .service(service)
                .build();
    }
}
