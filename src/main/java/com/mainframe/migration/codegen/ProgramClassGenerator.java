package com.mainframe.migration.codegen;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.codegen.mapper.JavaTypeMapper;
import com.mainframe.migration.codegen.model.FieldDefinition;
import com.mainframe.migration.codegen.model.ProcedureMethod;
import com.mainframe.migration.codegen.model.ProgramClassDefinition;
import com.mainframe.migration.codegen.template.TemplateFamily;
import com.mainframe.migration.codegen.template.TemplateRenderer;
import com.mainframe.migration.codegen.util.NamingUtil;
import com.mainframe.migration.model.DataItem;
import com.mainframe.migration.model.ProcedureRef;
import com.mainframe.migration.model.StructuralModel;

/**
 * Renders one Java class from a structural model.
 *
 * The generated class keeps the structure of the program: one field per
 * data item, one stub per paragraph in source order, accessors per field and
 * a single execute() entry point. Paragraph bodies are not translated.
 */
public class ProgramClassGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProgramClassGenerator.class);

    static final String CLASS_TEMPLATE = "ProgramClass.java.ftl";

    /**
     * Method names the template itself declares.
     */
    private static final Set<String> TEMPLATE_METHODS = Set.of("main", "execute", "mainLogic");

    private static final Set<String> TEMPLATE_FIELDS = Set.of("log");

    private final TemplateRenderer renderer;
    private final String packageName;
    private final String reservedPrefix;

    public ProgramClassGenerator(TemplateRenderer renderer, String packageName, String reservedPrefix) {
        this.renderer = renderer;
        this.packageName = packageName;
        this.reservedPrefix = reservedPrefix;
    }

    /**
     * Generate the source text of the class for {@code programName}.
     *
     * @param programName resolved program name, used as class name
     * @param model       analyzed model, or a placeholder
     * @param targetStack advisory target hint selecting the template family
     * @return complete Java compilation unit
     */
    public String generate(String programName, StructuralModel model, String targetStack) {
        ProgramClassDefinition definition = buildDefinition(programName, model);
        TemplateFamily family = TemplateFamily.forTargetStack(targetStack);
        log.debug("Rendering {} with {} fields and {} procedure stubs",
                definition.getClassName(), definition.getFields().size(), definition.getMethods().size());

        Map<String, Object> dataModel = new HashMap<>();
        dataModel.put("program", definition);
        return renderer.render(family, CLASS_TEMPLATE, dataModel);
    }

    ProgramClassDefinition buildDefinition(String programName, StructuralModel model) {
        String className = NamingUtil.toClassName(programName);
        ProgramClassDefinition.ProgramClassDefinitionBuilder builder = ProgramClassDefinition.builder()
                .packageName(packageName)
                .className(className)
                .programId(NamingUtil.toCommentSafe(model.getProgramId()));

        Set<String> fieldNames = new HashSet<>(TEMPLATE_FIELDS);
        for (DataItem item : model.getDataItems()) {
            builder.field(buildField(item, fieldNames));
        }

        Set<String> methodNames = new HashSet<>(TEMPLATE_METHODS);
        for (FieldDefinition field : builder.build().getFields()) {
            methodNames.add(field.getGetterName());
            methodNames.add(field.getSetterName());
        }
        for (ProcedureRef procedure : model.getProcedures()) {
            String name = NamingUtil.toLegalIdentifier(
                    NamingUtil.toJavaIdentifier(procedure.getName(), reservedPrefix), "para", "Para");
            builder.method(ProcedureMethod.builder()
                    .sourceName(procedure.getName())
                    .name(unique(name, methodNames))
                    .build());
        }

        return builder.build();
    }

    private FieldDefinition buildField(DataItem item, Set<String> usedNames) {
        String mapped = NamingUtil.toLegalIdentifier(
                NamingUtil.toJavaIdentifier(item.getName(), reservedPrefix), "field", "Value");
        // FILLER and repeated names under different groups map to the same identifier
        String name = unique(mapped, usedNames);
        return FieldDefinition.builder()
                .sourceName(item.getName())
                .name(name)
                .javaType(JavaTypeMapper.javaType(item.getInferredType()))
                .initializer(JavaTypeMapper.initializer(item))
                .getterName(NamingUtil.getterName(name))
                .setterName(NamingUtil.setterName(name))
                .build();
    }

    private static String unique(String name, Set<String> used) {
        String candidate = name;
        int counter = 2;
        while (!used.add(candidate)) {
            candidate = name + counter++;
        }
        return candidate;
    }
}
