package dev.pekelund.ezexpense.categories;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.client.response.MockRestResponseCreators;
import org.springframework.web.client.RestClient;

class RemoteCategoryCatalogTest {

    private MockRestServiceServer server;
    private RemoteCategoryCatalog catalog;

    @BeforeEach
    void setUp() {
        CategoryProperties properties = new CategoryProperties();
        properties.setBaseUrl("http://localhost");

        RestClient.Builder restClientBuilder = RestClient.builder();
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        catalog = new RemoteCategoryCatalog(restClientBuilder.build(), properties);
    }

    @Test
    void readsCategoryList() {
        server.expect(MockRestRequestMatchers.requestTo("http://localhost/api/category-list"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.GET))
            .andRespond(MockRestResponseCreators.withSuccess("{\"categories\":[\"Airfare\",\"Meals\"]}",
                MediaType.APPLICATION_JSON));

        assertThat(catalog.categories()).containsExactly("Airfare", "Meals");
        server.verify();
    }

    @Test
    void failsWhenEndpointErrors() {
        server.expect(MockRestRequestMatchers.requestTo("http://localhost/api/category-list"))
            .andRespond(MockRestResponseCreators.withServerError());

        assertThatThrownBy(() -> catalog.categories()).isInstanceOf(CategoryCatalogException.class);
    }

    @Test
    void failsWhenResponseHasNoList() {
        server.expect(MockRestRequestMatchers.requestTo("http://localhost/api/category-list"))
            .andRespond(MockRestResponseCreators.withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> catalog.categories())
            .isInstanceOf(CategoryCatalogException.class)
            .hasMessageContaining("returned no categories");
    }
}
