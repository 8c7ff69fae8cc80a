package work.vernacular.kernel.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.ExecutionEngine;
import work.vernacular.kernel.runtime.LeafResult;
import work.vernacular.kernel.shared.Values;

/**
 * Text, JSON, CSV, YAML and XML file commands. Paths are resolved against the environment's working directory.
 */
public final class FileCommands {
    static final String ROWS_VARIABLE = "rows";

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final XmlMapper XML = XmlMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build();

    private FileCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register("file/exists", "(?:check if file (\\S+) exists|does file (\\S+) exist\\??)", FileCommands::exists);
        registry.register("file/save-list", "save list (\\w+) to (\\S+\\.json)", FileCommands::saveList);
        registry.register("file/load-list", "load list (\\w+) from (\\S+\\.json)", FileCommands::loadList);
        registry.register("file/csv-create", "create (?:a )?CSV file (\\S+\\.csv) with headers (.+)", FileCommands::createCsv);
        registry.register("file/csv-row", "add row (.+) to CSV (\\S+\\.csv)", FileCommands::addCsvRow);
        registry.register("file/csv-read", "read (?:the )?CSV file (\\S+\\.csv)", FileCommands::readCsv);
        registry.register("file/yaml-save", "save (?:data|variables) to (\\S+\\.ya?ml)", FileCommands::saveYaml);
        registry.register("file/yaml-load", "load (?:data|variables) from (\\S+\\.ya?ml)", FileCommands::loadYaml);
        registry.register("file/xml-save", "save (?:data|variables) to (\\S+\\.xml)", FileCommands::saveXml);
        registry.register("file/xml-load", "load (?:data|variables) from (\\S+\\.xml)", FileCommands::loadXml);
        registry.register("file/save-text", "(?:save|write) (.+) to (\\S+\\.txt)", (ctx, m) -> writeText(ctx, m, false));
        registry.register("file/append-text", "append (.+) to (\\S+\\.txt)", (ctx, m) -> writeText(ctx, m, true));
        registry.register("file/read-text", "(?:read (?:the contents of )?|load )(\\S+\\.txt)", FileCommands::readText);
        registry.register("file/delete", "delete file (\\S+)", FileCommands::delete);
        registry.register("file/copy", "copy file (\\S+) to (\\S+)", FileCommands::copy);
        return registry;
    }

    private static LeafResult exists(CommandContext ctx, Matcher m) {
        var name = m.group(1) != null ? m.group(1) : m.group(2);
        var exists = Files.exists(ctx.resolvePath(Values.unquote(name)));
        ctx.println("File '" + Values.unquote(name) + "' " + (exists ? "exists" : "does not exist"));
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, exists);
        return LeafResult.value(exists);
    }

    private static LeafResult writeText(CommandContext ctx, Matcher m, boolean append) throws IOException {
        var text = Operands.text(ctx.scopes(), m.group(1));
        var target = ctx.resolvePath(m.group(2));
        createParents(target);
        if (append) {
            Files.writeString(target, text + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } else {
            Files.writeString(target, text, StandardCharsets.UTF_8);
        }
        return LeafResult.done();
    }

    private static LeafResult readText(CommandContext ctx, Matcher m) throws IOException {
        var content = Files.readString(existing(ctx, m.group(1)), StandardCharsets.UTF_8);
        ctx.println(content);
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, content);
        return LeafResult.value(content);
    }

    private static LeafResult delete(CommandContext ctx, Matcher m) throws IOException {
        Files.delete(existing(ctx, m.group(1)));
        return LeafResult.done();
    }

    private static LeafResult copy(CommandContext ctx, Matcher m) throws IOException {
        var source = existing(ctx, m.group(1));
        var target = ctx.resolvePath(m.group(2));
        createParents(target);
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        return LeafResult.done();
    }

    private static LeafResult saveList(CommandContext ctx, Matcher m) throws IOException {
        var list = Operands.list(ctx.scopes(), m.group(1));
        var target = ctx.resolvePath(m.group(2));
        createParents(target);
        JSON.writeValue(target.toFile(), list);
        return LeafResult.done();
    }

    private static LeafResult loadList(CommandContext ctx, Matcher m) throws IOException {
        var source = existing(ctx, m.group(2));
        var loaded = JSON.readValue(source.toFile(), Object.class);
        if (!(loaded instanceof List<?>)) {
            throw new CommandFailedException("'" + m.group(2) + "' does not contain a JSON array");
        }
        var list = Values.normalizeLoaded(loaded);
        ctx.scopes().assign(m.group(1), list);
        return LeafResult.value(list);
    }

    private static LeafResult createCsv(CommandContext ctx, Matcher m) throws IOException {
        var headers = new ArrayList<String>();
        for (var header : Values.splitList(m.group(2))) {
            headers.add(Values.unquote(header));
        }
        var target = ctx.resolvePath(m.group(1));
        createParents(target);
        var format = CSVFormat.DEFAULT.builder().setHeader(headers.toArray(String[]::new)).build();
        try (var printer = new CSVPrinter(Files.newBufferedWriter(target, StandardCharsets.UTF_8), format)) {
            printer.flush();
        }
        return LeafResult.done();
    }

    private static LeafResult addCsvRow(CommandContext ctx, Matcher m) throws IOException {
        var target = existing(ctx, m.group(2));
        var values = new ArrayList<String>();
        for (var item : Values.splitList(m.group(1))) {
            values.add(Values.format(Operands.valueOrText(ctx.scopes(), item)));
        }
        try (var printer = new CSVPrinter(
            Files.newBufferedWriter(target, StandardCharsets.UTF_8, StandardOpenOption.APPEND), CSVFormat.DEFAULT)) {
            printer.printRecord(values);
        }
        return LeafResult.done();
    }

    private static LeafResult readCsv(CommandContext ctx, Matcher m) throws IOException {
        var source = existing(ctx, m.group(1));
        var format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).setTrim(true).build();
        var rows = new ArrayList<Object>();
        try (var reader = Files.newBufferedReader(source, StandardCharsets.UTF_8); var parser = format.parse(reader)) {
            var headers = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                var row = new LinkedHashMap<String, Object>();
                for (var header : headers) {
                    row.put(header, record.isSet(header) ? Values.parseLiteral(record.get(header)) : null);
                }
                rows.add(row);
                ctx.println(Values.format(row));
            }
        }
        ctx.scopes().assign(ROWS_VARIABLE, rows);
        return LeafResult.value(rows);
    }

    private static LeafResult saveYaml(CommandContext ctx, Matcher m) throws IOException {
        var target = ctx.resolvePath(m.group(1));
        createParents(target);
        YAML.writeValue(target.toFile(), new LinkedHashMap<>(ctx.scopes().snapshot()));
        return LeafResult.done();
    }

    private static LeafResult loadYaml(CommandContext ctx, Matcher m) throws IOException {
        var source = existing(ctx, m.group(1));
        Map<String, Object> loaded = YAML.readValue(source.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
        if (loaded == null) {
            return LeafResult.done();
        }
        for (var entry : loaded.entrySet()) {
            ctx.scopes().assign(entry.getKey(), Values.normalizeLoaded(entry.getValue()));
        }
        return LeafResult.value(loaded.size());
    }

    private static LeafResult saveXml(CommandContext ctx, Matcher m) throws IOException {
        var document = new XmlSnapshot();
        for (var entry : ctx.scopes().snapshot().entrySet()) {
            if (entry.getValue() instanceof List<?> items) {
                var list = new XmlList();
                list.name = entry.getKey();
                for (var item : items) {
                    list.items.add(Values.format(item));
                }
                document.lists.add(list);
            } else {
                var variable = new XmlVariable();
                variable.name = entry.getKey();
                variable.type = Values.typeName(entry.getValue());
                variable.value = Values.format(entry.getValue());
                document.variables.add(variable);
            }
        }
        var target = ctx.resolvePath(m.group(1));
        createParents(target);
        XML.writeValue(target.toFile(), document);
        return LeafResult.value(document.variables.size() + document.lists.size());
    }

    private static LeafResult loadXml(CommandContext ctx, Matcher m) throws IOException {
        var document = XML.readValue(existing(ctx, m.group(1)).toFile(), XmlSnapshot.class);
        int loaded = 0;
        if (document.variables != null) {
            for (var variable : document.variables) {
                ctx.scopes().assign(variable.name, fromXml(variable));
                loaded++;
            }
        }
        if (document.lists != null) {
            for (var list : document.lists) {
                var items = new ArrayList<Object>();
                if (list.items != null) {
                    for (var item : list.items) {
                        items.add(Values.parseLiteral(item));
                    }
                }
                ctx.scopes().assign(list.name, items);
                loaded++;
            }
        }
        return LeafResult.value(loaded);
    }

    // int and bool are accepted as aliases; any other type name loads as text
    private static Object fromXml(XmlVariable variable) {
        var text = variable.value == null ? "" : variable.value;
        var type = variable.type == null ? "string" : variable.type;
        try {
            switch (type) {
                case "integer":
                case "int":
                    return Long.parseLong(text.strip());
                case "float":
                    return Double.parseDouble(text.strip());
                case "boolean":
                case "bool":
                    return Boolean.parseBoolean(text.strip());
                default:
                    return text;
            }
        } catch (NumberFormatException ex) {
            throw new CommandFailedException("Variable '" + variable.name + "' has invalid " + type + " value '" + text + "'");
        }
    }

    private static Path existing(CommandContext ctx, String name) throws NoSuchFileException {
        var path = ctx.resolvePath(Values.unquote(name));
        if (!Files.exists(path)) {
            throw new NoSuchFileException(Values.unquote(name));
        }
        return path;
    }

    private static void createParents(Path target) throws IOException {
        var parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    @JacksonXmlRootElement(localName = "vernacular_data")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    static final class XmlSnapshot {
        @JacksonXmlElementWrapper(localName = "variables")
        @JacksonXmlProperty(localName = "variable")
        public List<XmlVariable> variables = new ArrayList<>();

        @JacksonXmlElementWrapper(localName = "lists")
        @JacksonXmlProperty(localName = "list")
        public List<XmlList> lists = new ArrayList<>();
    }

    static final class XmlVariable {
        @JacksonXmlProperty(isAttribute = true)
        public String name;

        @JacksonXmlProperty(isAttribute = true)
        public String type;

        @JacksonXmlText
        public String value;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    static final class XmlList {
        @JacksonXmlProperty(isAttribute = true)
        public String name;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "item")
        public List<String> items = new ArrayList<>();
    }
}
