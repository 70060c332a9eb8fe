package org.carball.dbml.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;
import org.carball.dbml.model.schema.Project;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Maps a {@link Project} to and from JSON or YAML documents.
 *
 * <p>Property names follow the bean names of the schema model. Unset optional fields are left
 * out of written documents; unknown properties in read documents are ignored.
 */
@Slf4j
public class ProjectSerializer {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ProjectSerializer() {
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public String toJson(Project project) throws JsonProcessingException {
        return jsonMapper.writeValueAsString(project);
    }

    public Project fromJson(String json) throws JsonProcessingException {
        return jsonMapper.readValue(json, Project.class);
    }

    public String toYaml(Project project) throws JsonProcessingException {
        return yamlMapper.writeValueAsString(project);
    }

    public Project fromYaml(String yaml) throws JsonProcessingException {
        return yamlMapper.readValue(yaml, Project.class);
    }

    /**
     * Reads a project document, choosing JSON or YAML by file extension.
     */
    public Project read(Path file) throws IOException {
        return isYaml(file) ? readYaml(file) : readJson(file);
    }

    public Project readJson(Path file) throws IOException {
        return loaded(fromJson(Files.readString(file)), file);
    }

    public Project readYaml(Path file) throws IOException {
        return loaded(fromYaml(Files.readString(file)), file);
    }

    /**
     * Writes a project document, choosing JSON or YAML by file extension.
     */
    public void write(Project project, Path file) throws IOException {
        String content = isYaml(file) ? toYaml(project) : toJson(project);
        Files.writeString(file, content);
        log.debug("Wrote project '{}' to {}", project.getName(), file);
    }

    private static Project loaded(Project project, Path file) {
        log.info("Loaded project '{}' from {}", project.getName(), file);
        return project;
    }

    static boolean isYaml(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yml") || fileName.endsWith(".yaml");
    }
}
