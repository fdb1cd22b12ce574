package com.firesim.dispatch.api;

import com.firesim.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Serves stored artifacts through the URLs minted by the artifact store.
 */
@RestController
@RequestMapping("/api/v1/artifacts")
public class ArtifactController {

    private static final Logger log = LoggerFactory.getLogger(ArtifactController.class);

    private final ArtifactStore artifactStore;
    private final Clock clock;

    public ArtifactController(ArtifactStore artifactStore, Clock clock) {
        this.artifactStore = artifactStore;
        this.clock = clock;
    }

    /**
     * GET /api/v1/artifacts/{runId}/{file}: Raw artifact bytes. Every minted URL carries {@code expires};
     * a URL without it, or past it, returns 410.
     */
    @GetMapping("/{runId}/{file:.+}")
    public ResponseEntity<byte[]> getArtifact(@PathVariable String runId, @PathVariable String file,
                                              @RequestParam(required = false) Long expires) {
        if (expires == null || expires < clock.instant().getEpochSecond()) {
            return ResponseEntity.status(HttpStatus.GONE).build();
        }
        String key = runId + "/" + file;
        try {
            return artifactStore.load(key)
                    .map(bytes -> ResponseEntity.ok().contentType(contentType(file)).body(bytes))
                    .orElse(ResponseEntity.notFound().build());
        } catch (IllegalArgumentException e) {
            log.debug("Rejected artifact key {}: {}", key, e.getMessage());
            return ResponseEntity.notFound().build();
        }
    }

    static MediaType contentType(String file) {
        var lower = file.toLowerCase();
        if (lower.endsWith(".png")) return MediaType.IMAGE_PNG;
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) return MediaType.IMAGE_JPEG;
        if (lower.endsWith(".json")) return MediaType.APPLICATION_JSON;
        if (lower.endsWith(".md")) return MediaType.parseMediaType("text/markdown");
        return MediaType.APPLICATION_OCTET_STREAM;
    }
}
