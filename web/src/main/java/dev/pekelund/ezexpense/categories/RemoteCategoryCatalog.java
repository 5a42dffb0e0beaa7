package dev.pekelund.ezexpense.categories;

import dev.pekelund.ezexpense.reconciliation.CategoryCatalog;
import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

public class RemoteCategoryCatalog implements CategoryCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteCategoryCatalog.class);

    private final RestClient restClient;
    private final CategoryProperties properties;

    public RemoteCategoryCatalog(RestClient restClient, CategoryProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public List<String> categories() {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getPath())
            .build()
            .toUri();
        CategoryListResponse response;
        try {
            response = restClient.get().uri(uri).retrieve().body(CategoryListResponse.class);
        } catch (RestClientException ex) {
            throw new CategoryCatalogException("Failed to load expense categories from " + uri, ex);
        }
        if (response == null || response.categories() == null) {
            throw new CategoryCatalogException("Category endpoint " + uri + " returned no categories");
        }
        LOGGER.info("Loaded {} expense categories", response.categories().size());
        return List.copyOf(response.categories());
    }

    public record CategoryListResponse(List<String> categories) {
    }
}
