package it.aw.sectionrank.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.sectionrank.exception.InputSpecException;
import it.aw.sectionrank.model.InputSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Legge la specifica JSON di una collezione.
 * <p>
 * Formati accettati:
 * <pre>
 * {
 *   "documents":      [{"filename": "a.pdf", "title": "..."}, "b.pdf"],
 *   "persona":        {"role": "PhD Researcher"}   oppure "PhD Researcher",
 *   "job_to_be_done": {"task": "..."}              oppure "..."   (alias: "job")
 * }
 * </pre>
 * Persona e job assenti diventano stringhe vuote; la lista documenti è obbligatoria.
 */
@Service
public class InputSpecReader {

    private static final Logger log = LoggerFactory.getLogger(InputSpecReader.class);

    private final ObjectMapper objectMapper;

    public InputSpecReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws InputSpecException se il file manca, non è JSON valido o non elenca documenti
     */
    public InputSpec read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new InputSpecException("Specifica di input non trovata: " + path.toAbsolutePath());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new InputSpecException("Specifica di input non valida: " + path.toAbsolutePath(), e);
        }
        InputSpec spec = parse(root);
        log.info("Specifica letta: {} documenti, persona='{}', job='{}'",
                spec.documents().size(), spec.persona(), spec.job());
        return spec;
    }

    InputSpec parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InputSpecException("La specifica di input deve essere un oggetto JSON");
        }
        JsonNode docsNode = root.get("documents");
        if (docsNode == null || !docsNode.isArray() || docsNode.isEmpty()) {
            throw new InputSpecException("La specifica di input non elenca alcun documento");
        }
        List<String> documents = new ArrayList<>();
        for (JsonNode doc : docsNode) {
            String filename = doc.isTextual() ? doc.asText() : doc.path("filename").asText("");
            if (filename.isBlank()) {
                throw new InputSpecException("Documento senza filename nella specifica: " + doc);
            }
            documents.add(filename.trim());
        }

        String persona = textOf(root.get("persona"), "role");
        JsonNode jobNode = root.has("job_to_be_done") ? root.get("job_to_be_done") : root.get("job");
        String job = textOf(jobNode, "task");
        return new InputSpec(documents, persona, job);
    }

    /**
     * Testo di un campo che può essere stringa o oggetto strutturato: per gli
     * oggetti si usa il campo preferito, altrimenti il primo campo testuale.
     */
    private static String textOf(JsonNode node, String preferredField) {
        if (node == null || node.isNull()) return "";
        if (node.isTextual()) return node.asText().trim();
        if (node.isObject()) {
            JsonNode preferred = node.get(preferredField);
            if (preferred != null && preferred.isTextual()) return preferred.asText().trim();
            Iterator<JsonNode> it = node.elements();
            while (it.hasNext()) {
                JsonNode value = it.next();
                if (value.isTextual()) return value.asText().trim();
            }
        }
        return "";
    }
}
