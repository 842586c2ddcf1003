package com.example.ytmdl.service;

import com.example.ytmdl.config.QueueProperties;
import com.example.ytmdl.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Accepts http(s) links to one of the configured hosts that point at a resource: a short link
 * with an id, or one of the configured paths.
 */
@Service
@RequiredArgsConstructor
public class UrlValidationService {
    private final QueueProperties queueProperties;

    public String validate(String rawUrl) {
        if (rawUrl == null || rawUrl.trim().isEmpty()) {
            throw new ValidationException("URL is required");
        }
        String url = rawUrl.trim();

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ValidationException("Malformed URL: " + url);
        }

        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new ValidationException("URL must start with http:// or https://: " + url);
        }

        String host = uri.getHost();
        if (host == null || !queueProperties.getAcceptedHosts().contains(host.toLowerCase(Locale.ROOT))) {
            throw new ValidationException("Unsupported host in URL: " + url);
        }

        String path = uri.getPath() == null ? "" : uri.getPath();
        if (!hasResourcePath(host.toLowerCase(Locale.ROOT), path)) {
            throw new ValidationException("URL does not reference a track, album or playlist: " + url);
        }
        return url;
    }

    private boolean hasResourcePath(String host, String path) {
        if (host.equals("youtu.be")) {
            return path.length() > 1;
        }
        return queueProperties.getAcceptedPaths().stream()
                .anyMatch(prefix -> path.equals(prefix) || path.startsWith(prefix + "/"));
    }
}
