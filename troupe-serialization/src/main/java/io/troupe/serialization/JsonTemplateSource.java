package io.troupe.serialization;

import io.troupe.core.template.Template;
import io.troupe.core.template.TemplateInvalidException;
import io.troupe.core.template.TemplateNotFoundException;
import io.troupe.core.template.TemplateSource;
import io.troupe.core.template.TemplateSummary;
import io.troupe.core.template.TemplateValidator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Template source reading {@code <id>.json} files from a directory.
 *
 * <p>Each template is parsed and validated on first load and cached afterwards. The {@code id}
 * inside the file must match the file name.
 *
 * @implNote Thread-safe. Files changed after their first load are not re-read.
 */
public final class JsonTemplateSource implements TemplateSource {

    private static final Logger logger = Logger.getLogger(JsonTemplateSource.class.getName());

    static final String EXTENSION = ".json";

    private final Path directory;
    private final TemplateValidator validator;
    private final Map<String, Template> cache = new ConcurrentHashMap<>();

    /**
     * Creates a source over a directory.
     *
     * @param directory directory holding template files, not null
     * @param validator validator applied to every loaded template, not null
     * @throws IllegalArgumentException if the directory does not exist
     */
    public JsonTemplateSource(Path directory, TemplateValidator validator) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
    }

    @Override
    public Template load(String templateId) {
        Objects.requireNonNull(templateId, "templateId must not be null");
        Template cached = cache.get(templateId);
        if (cached != null) {
            return cached;
        }
        Template template = read(templateId);
        cache.put(templateId, template);
        return template;
    }

    /**
     * Lists every template in the directory. Files that fail to load are logged and left out.
     *
     * @return summaries sorted by id, never null
     * @throws UncheckedIOException if the directory cannot be listed
     */
    @Override
    public List<TemplateSummary> list() {
        List<TemplateSummary> summaries = new ArrayList<>();
        for (String id : templateIds()) {
            try {
                summaries.add(load(id).toSummary());
            } catch (TemplateInvalidException e) {
                logger.warning("Skipping invalid template " + id + ": " + e.getMessage());
            }
        }
        summaries.sort(Comparator.comparing(TemplateSummary::id));
        return summaries;
    }

    private List<String> templateIds() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list templates in " + directory, e);
        }
    }

    private Template read(String templateId) {
        Path file = directory.resolve(templateId + EXTENSION);
        if (!file.normalize().startsWith(directory.normalize()) || !Files.isRegularFile(file)) {
            throw new TemplateNotFoundException(templateId);
        }

        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateInvalidException(templateId, "unreadable file " + file, e);
        }

        Template template;
        try {
            template = TemplateSerializer.fromJson(json);
        } catch (IllegalArgumentException e) {
            throw new TemplateInvalidException(templateId, "malformed JSON", e);
        }
        if (!templateId.equals(template.getId())) {
            throw new TemplateInvalidException(
                    templateId,
                    List.of("file declares id '" + template.getId() + "'"));
        }
        logger.fine("Loaded template " + templateId + " from " + file);
        return validator.validate(template);
    }
}
