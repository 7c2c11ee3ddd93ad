package it.aw.sectionrank.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import it.aw.sectionrank.exception.ResultWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializza un risultato (output della pipeline o outline) in JSON indentato.
 */
@Service
public class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    private final ObjectMapper objectMapper;

    public ResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Object result, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            objectMapper.writeValue(path.toFile(), result);
            log.info("Risultato scritto: {}", path.toAbsolutePath());
        } catch (IOException e) {
            throw new ResultWriteException("Impossibile scrivere il risultato su " + path.toAbsolutePath(), e);
        }
    }
}
