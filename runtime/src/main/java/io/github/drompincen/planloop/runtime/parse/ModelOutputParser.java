package io.github.drompincen.planloop.runtime.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ModelOutputParser {

    private static final Logger log = LoggerFactory.getLogger(ModelOutputParser.class);

    private final JsonExtractor extractor;

    public ModelOutputParser(ObjectMapper objectMapper) {
        this.extractor = new JsonExtractor(objectMapper);
    }

    /**
     * @throws MalformedOutputException if the text is null or blank
     */
    public <T> T parse(String raw, OutputShape<T> shape) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedOutputException("Empty model response for " + shape.name());
        }
        Optional<JsonNode> json = extractor.extractFirst(raw, shape::accepts);
        if (json.isEmpty()) {
            log.warn("No usable JSON found in {} response, using fallback ({} chars)", shape.name(), raw.length());
            return shape.fallback(raw);
        }
        return shape.fromJson(json.get());
    }
}
