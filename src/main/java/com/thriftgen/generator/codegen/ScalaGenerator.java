package com.thriftgen.generator.codegen;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.mapper.ConstantRenderer;
import com.thriftgen.generator.codegen.mapper.ScalaTypeMapper;
import com.thriftgen.generator.codegen.service.ScalaService;
import com.thriftgen.generator.codegen.service.ServiceDictionaryBuilder;
import com.thriftgen.generator.codegen.struct.StructDictionaryBuilder;
import com.thriftgen.generator.codegen.util.ImportManager;
import com.thriftgen.generator.model.ConstDef;
import com.thriftgen.generator.model.Document;
import com.thriftgen.generator.model.EnumDef;
import com.thriftgen.generator.model.Include;
import com.thriftgen.generator.model.ServiceDef;
import com.thriftgen.generator.model.StructDef;
import com.thriftgen.generator.template.Dictionary;
import com.thriftgen.generator.template.Fragment;
import com.thriftgen.generator.template.FragmentLoader;
import com.thriftgen.generator.template.FragmentRegistry;

/**
 * Generates one Scala source file per schema document.
 *
 * <p>Output order is fixed: header and imports, constants, enums, structs, services.
 * Generating the same document twice yields identical text.
 */
public class ScalaGenerator {
    private static final Logger log = LoggerFactory.getLogger(ScalaGenerator.class);

    public static final List<String> FRAGMENT_NAMES =
            List.of("header", "consts", "enum", "enums", "struct", "service");

    private static final String SECTION_SEPARATOR = "\n\n";

    private final GeneratorConfig config;
    private final DocumentCamelizer camelizer = new DocumentCamelizer();

    private final Fragment<Document> headerFragment;
    private final Fragment<List<ConstDef>> constsFragment;
    private final Fragment<EnumDef> enumFragment;
    private final Fragment<List<EnumDef>> enumsFragment;
    private final Fragment<StructDef> structFragment;
    private final Fragment<ScalaService> serviceFragment;

    public ScalaGenerator(FragmentRegistry registry, GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(registry, "registry");
        log.debug("Binding fragments {} loaded from {}", registry.names(), registry.getPrefix());

        StructDictionaryBuilder structs = new StructDictionaryBuilder();
        this.headerFragment = registry.bind("header", this::headerDictionary);
        this.constsFragment = registry.bind("consts", ScalaGenerator::constsDictionary);
        this.enumFragment = registry.bind("enum", ScalaGenerator::enumDictionary);
        this.enumsFragment = registry.bind("enums", this::enumsDictionary);
        this.structFragment = registry.bind("struct", structs::build);
        ServiceDictionaryBuilder services = new ServiceDictionaryBuilder(structFragment, structs);
        this.serviceFragment = registry.bind("service", services::build);
    }

    /**
     * Registry of the fragments this generator needs, loaded from {@code config}'s prefix.
     */
    public static FragmentRegistry loadFragments(FragmentLoader loader, GeneratorConfig config) throws IOException {
        return FragmentRegistry.load(loader, config.getTemplatePrefix(), FRAGMENT_NAMES);
    }

    public String generate(Document document) {
        return generate(document, config.getServiceOptions());
    }

    public String generate(Document rawDocument, Set<ServiceOption> serviceOptions) {
        Document doc = camelizer.camelize(rawDocument);
        log.debug("Generating {}: {} consts, {} enums, {} structs, {} services",
                doc.targetNamespace(config.getDefaultNamespace()), doc.getConsts().size(),
                doc.getEnums().size(), doc.getStructs().size(), doc.getServices().size());

        String constSection = constsFragment.render(doc.getConsts());
        String enumSection = enumsFragment.render(doc.getEnums());
        String structSection = joinSections(doc.getStructs().stream()
                .map(structFragment::render)
                .toList());
        String serviceSection = joinSections(doc.getServices().stream()
                .map(s -> serviceFragment.render(new ScalaService(s, serviceOptions)))
                .toList());

        return headerFragment.render(doc) + "\n" + constSection + enumSection + structSection + serviceSection;
    }

    // Per-entity entry points: the header followed by a single rendered entity.

    public String renderHeader(Document doc) {
        return headerFragment.render(doc);
    }

    public String renderEnum(Document doc, EnumDef enumDef) {
        return renderHeader(doc) + enumFragment.render(enumDef);
    }

    public String renderConsts(Document doc, List<ConstDef> consts) {
        return renderHeader(doc) + constsFragment.render(consts);
    }

    public String renderStruct(Document doc, StructDef struct) {
        return renderHeader(doc) + structFragment.render(struct);
    }

    public String renderService(Document doc, ServiceDef service) {
        return renderHeader(doc) + serviceFragment.render(new ScalaService(service, Set.of()));
    }

    Dictionary headerDictionary(Document doc) {
        String namespace = doc.targetNamespace(config.getDefaultNamespace());
        ImportManager imports = new ImportManager(namespace);
        imports.addNamespaces(doc.getHeaders().stream()
                .filter(Include.class::isInstance)
                .map(Include.class::cast)
                .map(include -> include.getDocument().targetNamespace(config.getDefaultNamespace()))
                .toList());

        return Dictionary.builder()
                .put("scalaNamespace", namespace)
                .put("hasImports", !imports.isEmpty())
                .put("imports", imports.getNamespaces().stream()
                        .map(ns -> Dictionary.builder().put("namespace", ns).build())
                        .toList())
                .build();
    }

    static Dictionary constsDictionary(List<ConstDef> consts) {
        List<Dictionary> constants = consts.stream()
                .map(c -> Dictionary.builder()
                        .put("name", c.getName())
                        .put("type", ScalaTypeMapper.scalaType(c.getType()))
                        .put("value", ConstantRenderer.render(c.getValue()))
                        .build())
                .toList();
        return Dictionary.builder()
                .put("hasConstants", !constants.isEmpty())
                .put("constants", constants)
                .build();
    }

    static Dictionary enumDictionary(EnumDef enumDef) {
        List<Dictionary> values = enumDef.getValues().stream()
                .map(value -> Dictionary.builder()
                        .put("name", value.getName())
                        .put("nameLowerCase", value.getName().toLowerCase(Locale.ROOT))
                        .put("value", Integer.toString(value.getValue()))
                        .build())
                .toList();
        return Dictionary.builder()
                .put("enum_name", enumDef.getName())
                .put("values", values)
                .build();
    }

    Dictionary enumsDictionary(List<EnumDef> enums) {
        List<Dictionary> enumDictionaries = enums.stream()
                .map(enumFragment.unpacker())
                .toList();
        return Dictionary.builder()
                .put("hasEnums", !enumDictionaries.isEmpty())
                .put("enums", enumDictionaries)
                .put("enum", enumFragment.template())
                .build();
    }

    private static String joinSections(List<String> sections) {
        if (sections.isEmpty()) {
            return "";
        }
        return sections.stream().collect(Collectors.joining(SECTION_SEPARATOR, "", SECTION_SEPARATOR));
    }
}
