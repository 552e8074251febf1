package com.irondust.catalog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OpenApiConfigTest {

    @Test
    public void tagsOnlyDescriptionOperations() {
        OpenApiConfig config = new OpenApiConfig();
        OpenAPI api = config.customOpenAPI();
        Operation build = new Operation();
        Operation health = new Operation();
        api.paths(new Paths()
                .addPathItem("/descriptions", new PathItem().post(build))
                .addPathItem("/healthz", new PathItem().get(health)));

        config.descriptionsTagCustomizer().customise(api);

        assertEquals(List.of("descriptions"), build.getTags());
        assertNull(health.getTags());
        assertEquals("Catalog Description API", api.getInfo().getTitle());
    }
}
