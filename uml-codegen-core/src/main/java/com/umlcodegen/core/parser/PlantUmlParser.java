package com.umlcodegen.core.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.umlcodegen.core.model.Attribute;
import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.Method;
import com.umlcodegen.core.model.ParseResult;
import com.umlcodegen.core.model.SkippedLine;
import com.umlcodegen.core.model.UmlClass;
import com.umlcodegen.core.model.UmlEntity;
import com.umlcodegen.core.model.UmlEnum;
import com.umlcodegen.core.model.UmlInterface;
import com.umlcodegen.core.parser.MemberParser.MemberLine;

/**
 * Line-oriented parser for PlantUML class diagrams.
 *
 * <p>Parsing is best-effort and never throws for malformed text: lines that cannot be used
 * are skipped. {@link #parseWithDiagnostics(String)} reports them with their line number
 * and the reason.
 *
 * <p>Recognized per line, in priority order:
 * <ol>
 *   <li>{@code package} or {@code namespace} headers opening a package</li>
 *   <li>a bare closing brace, closing the innermost package when no entity body is open</li>
 *   <li>{@code [abstract] class Name<T>}, {@code abstract Name}, {@code interface Name<T>}
 *       and {@code enum Name} headers</li>
 *   <li>member lines and braces inside an entity body</li>
 *   <li>relationship lines outside entity bodies</li>
 * </ol>
 *
 * <p>Package braces and entity braces are counted separately, so a closing brace is always
 * attributed to the block that is actually open. The parser keeps no state between calls
 * and may be shared.
 *
 * @since 1.0.0
 */
public class PlantUmlParser {

    private static final Logger log = LoggerFactory.getLogger(PlantUmlParser.class);

    private static final Pattern STEREOTYPE_PATTERN = Pattern.compile("<<.*?>>");
    private static final Pattern IGNORED_BLOCK_PATTERN = Pattern.compile("^(?:skinparam|style)\\b.*\\{$");
    private static final Pattern ENUM_VALUE_PATTERN = Pattern.compile("^(\\w+)");

    /**
     * Cursor state of one parse call.
     */
    private static final class ParseState {
        final ClassDiagram diagram = new ClassDiagram();
        final List<SkippedLine> skipped = new ArrayList<>();

        // one entry per open package brace; its size is the package depth
        final Deque<String> packageStack = new ArrayDeque<>();
        String unbracedPackage;

        UmlEntity currentEntity;
        boolean inEntityDefinition;
        int entityDepth;

        // header seen without a brace; a following bare "{" opens its body
        UmlEntity pendingEntity;

        boolean inNote;
        boolean inIgnoredBlock;

        String currentPackage() {
            return packageStack.isEmpty() ? unbracedPackage : packageStack.peek();
        }

        int packageDepth() {
            return packageStack.size();
        }

        void skip(int lineNumber, String text, String reason) {
            log.debug("Skipping line {} ({}): {}", lineNumber, reason, text);
            skipped.add(new SkippedLine(lineNumber, text, reason));
        }
    }

    /**
     * Parses diagram text.
     *
     * @param text PlantUML text, may be null or blank
     * @return parsed diagram, empty for null or blank text
     */
    public ClassDiagram parse(String text) {
        return parseWithDiagnostics(text).diagram();
    }

    /**
     * Parses diagram text and reports the lines that contributed nothing.
     *
     * @param text PlantUML text, may be null or blank
     * @return parsed diagram with skipped lines
     */
    public ParseResult parseWithDiagnostics(String text) {
        ParseState state = new ParseState();
        List<String> lines = PlantUmlSanitizer.sanitize(text);

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.isEmpty()) {
                processLine(state, i + 1, line);
            }
        }

        if (state.inEntityDefinition) {
            log.debug("Entity '{}' was not closed before end of input", state.currentEntity.name());
        }

        ClassDiagram diagram = state.diagram;
        log.debug("Parsed {} classes, {} interfaces, {} enums, {} relationships ({} lines skipped)",
            diagram.classes().size(), diagram.interfaces().size(), diagram.enums().size(),
            diagram.relationships().size(), state.skipped.size());
        return new ParseResult(diagram, state.skipped);
    }

    private void processLine(ParseState state, int lineNumber, String line) {
        if (state.inNote) {
            if (PlantUmlPatterns.NOTE_END_PATTERN.matcher(line).matches()) {
                state.inNote = false;
            }
            state.skip(lineNumber, line, "note");
            return;
        }
        if (state.inIgnoredBlock) {
            if ("}".equals(line)) {
                state.inIgnoredBlock = false;
            }
            state.skip(lineNumber, line, "unsupported directive");
            return;
        }

        if (state.pendingEntity != null) {
            UmlEntity pending = state.pendingEntity;
            state.pendingEntity = null;
            if ("{".equals(line)) {
                openEntityBody(state, pending);
                return;
            }
        }

        if (state.inEntityDefinition) {
            processBodyLine(state, lineNumber, line);
            return;
        }

        if (PlantUmlPatterns.SEPARATOR_PATTERN.matcher(line).matches()) {
            return;
        }

        Matcher packageMatcher = PlantUmlPatterns.PACKAGE_PATTERN.matcher(line);
        if (packageMatcher.matches()) {
            openPackage(state, packageMatcher);
            return;
        }

        if ("}".equals(line)) {
            if (state.packageDepth() > 0) {
                closePackage(state);
            } else {
                state.skip(lineNumber, line, "unbalanced closing brace");
            }
            return;
        }

        if (startEntity(state, lineNumber, line)) {
            return;
        }

        if (PlantUmlPatterns.NOTE_START_PATTERN.matcher(line).matches()) {
            // single-line notes carry their text after a colon or in quotes
            state.inNote = !line.contains(":") && !line.contains("\"");
            state.skip(lineNumber, line, "note");
            return;
        }

        if (IGNORED_BLOCK_PATTERN.matcher(line).matches()) {
            state.inIgnoredBlock = true;
            state.skip(lineNumber, line, "unsupported directive");
            return;
        }

        if (RelationshipParser.containsArrow(line)) {
            RelationshipParser.parse(line).ifPresentOrElse(
                relationship -> state.diagram.relationships().add(relationship),
                () -> state.skip(lineNumber, line, "malformed relationship"));
            return;
        }

        state.skip(lineNumber, line, "unrecognized statement");
    }

    private void openPackage(ParseState state, Matcher matcher) {
        String name = STEREOTYPE_PATTERN.matcher(matcher.group(1)).replaceAll("").trim();
        state.diagram.packages().computeIfAbsent(name, key -> new ArrayList<>());
        if (matcher.group(2) != null) {
            state.packageStack.push(name);
        } else {
            state.unbracedPackage = name;
        }
        log.debug("Entering package '{}' (depth {})", name, state.packageDepth());
    }

    private void closePackage(ParseState state) {
        String closed = state.packageStack.pop();
        if (state.packageDepth() == 0) {
            state.unbracedPackage = null;
        }
        log.debug("Leaving package '{}'", closed);
    }

    /**
     * Recognizes an entity header and registers the entity.
     *
     * @return true if the line was a header
     */
    private boolean startEntity(ParseState state, int lineNumber, String line) {
        String packageName = state.currentPackage();
        UmlEntity entity;
        int headerEnd;

        Matcher classMatcher = PlantUmlPatterns.CLASS_PATTERN.matcher(line);
        Matcher interfaceMatcher = PlantUmlPatterns.INTERFACE_PATTERN.matcher(line);
        Matcher enumMatcher = PlantUmlPatterns.ENUM_PATTERN.matcher(line);
        if (interfaceMatcher.lookingAt()) {
            UmlInterface umlInterface = new UmlInterface(interfaceMatcher.group(1), packageName);
            umlInterface.generics().addAll(genericNames(interfaceMatcher.group(2)));
            state.diagram.interfaces().add(umlInterface);
            entity = umlInterface;
            headerEnd = interfaceMatcher.end();
        } else if (enumMatcher.lookingAt()) {
            UmlEnum umlEnum = new UmlEnum(enumMatcher.group(1), packageName);
            state.diagram.enums().add(umlEnum);
            entity = umlEnum;
            headerEnd = enumMatcher.end();
        } else if (classMatcher.lookingAt() && !RelationshipParser.containsArrow(line)) {
            UmlClass umlClass = new UmlClass(classMatcher.group(2), classMatcher.group(1) != null, packageName);
            umlClass.generics().addAll(genericNames(classMatcher.group(3)));
            state.diagram.classes().add(umlClass);
            entity = umlClass;
            headerEnd = classMatcher.end();
        } else {
            return false;
        }

        if (packageName != null) {
            state.diagram.packages().computeIfAbsent(packageName, key -> new ArrayList<>()).add(entity.name());
        }
        log.debug("Found {} '{}' in package {}", entity.getClass().getSimpleName(), entity.name(), packageName);

        String rest = line.substring(headerEnd);
        int brace = rest.indexOf('{');
        if (brace < 0) {
            state.pendingEntity = entity;
            return true;
        }

        openEntityBody(state, entity);
        String inlineBody = rest.substring(brace + 1).trim();
        if (!inlineBody.isEmpty()) {
            processBodyLine(state, lineNumber, inlineBody);
        }
        return true;
    }

    private void openEntityBody(ParseState state, UmlEntity entity) {
        state.currentEntity = entity;
        state.inEntityDefinition = true;
        state.entityDepth = 1;
    }

    private void closeEntity(ParseState state) {
        state.currentEntity = null;
        state.inEntityDefinition = false;
        state.entityDepth = 0;
    }

    /**
     * Handles one line inside an entity body: brace accounting first, then the member text.
     */
    private void processBodyLine(ParseState state, int lineNumber, String line) {
        MemberLine member = MemberParser.split(line);
        String text = member.text();
        int opened = countOf(text, '{');
        int closed = countOf(text, '}');
        String content = text.replace("{", "").replace("}", "").trim();

        state.entityDepth += opened - closed;
        if (!content.isEmpty() && !PlantUmlPatterns.SEPARATOR_PATTERN.matcher(content).matches()) {
            addMember(state, lineNumber, line, member.withText(content));
        }
        if (state.entityDepth <= 0) {
            closeEntity(state);
        }
    }

    private void addMember(ParseState state, int lineNumber, String line, MemberLine member) {
        UmlEntity entity = state.currentEntity;
        if (entity instanceof UmlEnum umlEnum) {
            addEnumValues(state, lineNumber, line, umlEnum, member);
        } else if (entity instanceof UmlClass umlClass) {
            addClassMember(state, lineNumber, line, umlClass, member);
        } else if (entity instanceof UmlInterface umlInterface) {
            addInterfaceMember(state, lineNumber, line, umlInterface, member);
        }
    }

    private void addClassMember(ParseState state, int lineNumber, String line, UmlClass umlClass, MemberLine member) {
        Optional<Method> method = MemberParser.parseMethod(member, umlClass.name());
        if (method.isPresent()) {
            if (method.get().isConstructor()) {
                umlClass.constructors().add(method.get());
            } else {
                umlClass.methods().add(method.get());
            }
            return;
        }

        Optional<Attribute> attribute = MemberParser.parseAttribute(member);
        if (attribute.isPresent()) {
            umlClass.attributes().add(attribute.get());
        } else {
            state.skip(lineNumber, line, "unrecognized member");
        }
    }

    private void addInterfaceMember(ParseState state, int lineNumber, String line, UmlInterface umlInterface, MemberLine member) {
        Optional<Method> method = MemberParser.parseMethod(member, umlInterface.name());
        if (method.isEmpty()) {
            String reason = MemberParser.parseAttribute(member).isPresent()
                ? "interfaces cannot declare attributes"
                : "unrecognized member";
            state.skip(lineNumber, line, reason);
        } else if (method.get().isConstructor()) {
            state.skip(lineNumber, line, "interfaces cannot declare constructors");
        } else {
            umlInterface.methods().add(method.get());
        }
    }

    private void addEnumValues(ParseState state, int lineNumber, String line, UmlEnum umlEnum, MemberLine member) {
        if (member.hasModifiers() || MemberParser.hasVisibility(member)) {
            state.skip(lineNumber, line, "enum members are not supported");
            return;
        }

        boolean added = false;
        for (String token : member.text().split(",")) {
            Matcher matcher = ENUM_VALUE_PATTERN.matcher(token.trim());
            if (matcher.find()) {
                umlEnum.values().add(matcher.group(1));
                added = true;
            }
        }
        if (!added) {
            state.skip(lineNumber, line, "unrecognized enum value");
        }
    }

    private static List<String> genericNames(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .toList();
    }

    private static int countOf(String text, char c) {
        return (int) text.chars().filter(ch -> ch == c).count();
    }
}
