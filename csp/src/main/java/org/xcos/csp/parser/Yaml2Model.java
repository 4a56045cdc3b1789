package org.xcos.csp.parser;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.springframework.web.multipart.MultipartFile;
import org.xcos.csp.exceptions.InvalidModelException;
import org.xcos.csp.model.CSPModel;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a CSP model definition from an uploaded YAML document. The document uses the
 * same keys as the JSON form of {@link CSPModel}.
 */
public class Yaml2Model {
    /**
     * Private constructor to hide the implicit public one.
     */
    private Yaml2Model() {
        // Prevents instantiation
    }

    /**
     * Loads the YAML content of the file and maps it onto a {@link CSPModel}.
     *
     * @param file         the uploaded YAML file
     * @param objectMapper mapper used to bind the loaded document
     * @return the parsed model, not yet validated
     * @throws InvalidModelException if the file cannot be read or is not a model definition
     */
    public static CSPModel retrieveModelFromYaml(MultipartFile file, ObjectMapper objectMapper) {
        Yaml yaml = new Yaml();
        try (InputStream is = file.getInputStream()) {
            // 1) Load the YAML content
            Object document = yaml.load(is);
            if (!(document instanceof Map)) {
                throw new InvalidModelException(List.of("YAMLError: the document must be a mapping with the model's keys"));
            }

            // 2) Bind it to the model, converting scalars the same way JSON input is converted
            return objectMapper.convertValue(document, CSPModel.class);
        } catch (IOException e) {
            throw new InvalidModelException("FileError: the uploaded file could not be read", e);
        } catch (YAMLException e) {
            throw new InvalidModelException("YAMLError: the YAML file is not in the correct format", e);
        } catch (IllegalArgumentException e) {
            throw new InvalidModelException("ParserError: " + e.getMessage(), e);
        }
    }
}
