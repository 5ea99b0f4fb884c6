package com.umlcodegen.core.generator;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.UmlClass;
import com.umlcodegen.core.model.UmlEntity;
import com.umlcodegen.core.model.UmlEnum;
import com.umlcodegen.core.model.UmlInterface;

/**
 * Walks a diagram and assembles the output of a {@link CodeGenerator}'s hooks.
 *
 * <p>With package support, packages are emitted in declaration order, each member looked
 * up among classes, then interfaces, then enums. Entities listed in no package follow,
 * classes first, then interfaces, then enums. Without package support every class,
 * interface and enum is emitted in declaration order.
 *
 * <p>Package entries that name no declared entity are skipped.
 */
public final class DiagramWalker {

    private static final Logger log = LoggerFactory.getLogger(DiagramWalker.class);

    private final CodeGenerator generator;

    public DiagramWalker(CodeGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /**
     * Generates the source for a diagram.
     *
     * @param diagram diagram to walk
     * @return concatenated hook output
     */
    public String walk(ClassDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");

        StringBuilder code = new StringBuilder();
        code.append(generator.generateHeader(diagram));

        if (generator.supportsPackages()) {
            Set<String> packaged = new HashSet<>();
            for (Map.Entry<String, List<String>> entry : diagram.packages().entrySet()) {
                String packageName = entry.getKey();
                code.append(generator.generatePackageStart(packageName));
                for (String member : entry.getValue()) {
                    packaged.add(member);
                    diagram.findEntity(member).ifPresentOrElse(
                        entity -> code.append(render(entity, diagram)),
                        () -> log.debug("Package '{}' lists unknown entity '{}', skipping", packageName, member));
                }
                code.append(generator.generatePackageEnd(packageName));
            }
            appendUnpackaged(code, diagram, packaged);
        } else {
            appendUnpackaged(code, diagram, Set.of());
        }

        code.append(generator.generateFooter(diagram));
        return code.toString();
    }

    private void appendUnpackaged(StringBuilder code, ClassDiagram diagram, Set<String> packaged) {
        for (UmlClass umlClass : diagram.classes()) {
            if (!packaged.contains(umlClass.name())) {
                code.append(generator.generateClass(umlClass, diagram));
            }
        }
        for (UmlInterface umlInterface : diagram.interfaces()) {
            if (!packaged.contains(umlInterface.name())) {
                code.append(generator.generateInterface(umlInterface, diagram));
            }
        }
        for (UmlEnum umlEnum : diagram.enums()) {
            if (!packaged.contains(umlEnum.name())) {
                code.append(generator.generateEnum(umlEnum, diagram));
            }
        }
    }

    private String render(UmlEntity entity, ClassDiagram diagram) {
        if (entity instanceof UmlClass umlClass) {
            return generator.generateClass(umlClass, diagram);
        }
        if (entity instanceof UmlInterface umlInterface) {
            return generator.generateInterface(umlInterface, diagram);
        }
        return generator.generateEnum((UmlEnum) entity, diagram);
    }
}
