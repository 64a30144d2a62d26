package com.cnab.importer.domain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamSource;
import org.springframework.core.io.Resource;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * A file handed to the importer: its content, declared size and display name.
 *
 * <p>{@code size} is used only to reject empty uploads and {@code fileName} only for the
 * audit message.
 */
@Slf4j
public record CnabUpload(String fileName, long size, InputStreamSource content) {

    public static CnabUpload of(MultipartFile file) {
        if (file == null) {
            return new CnabUpload(null, 0, null);
        }
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
        return new CnabUpload(name, file.getSize(), file);
    }

    /**
     * Wraps a Spring {@link Resource}; a resource that does not exist or whose length cannot
     * be determined is treated as empty.
     */
    public static CnabUpload of(Resource resource) {
        if (resource == null || !resource.exists()) {
            return new CnabUpload(resource != null ? resource.getFilename() : null, 0, resource);
        }
        long length;
        try {
            length = resource.contentLength();
        } catch (IOException e) {
            log.warn("Cannot determine length of '{}': {}", resource.getFilename(), e.getMessage());
            length = 0;
        }
        return new CnabUpload(resource.getFilename(), length, resource);
    }

    public boolean isEmpty() {
        return content == null || size <= 0;
    }
}
