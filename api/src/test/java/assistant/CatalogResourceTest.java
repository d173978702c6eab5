package assistant;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import assistant.core.model.sync.McpServer;
import assistant.core.port.out.StorageSessionFactory;

@QuarkusTest
@DisplayName("Catalog Resource Tests")
public class CatalogResourceTest {

    @Inject
    StorageSessionFactory sessions;

    @Test
    @DisplayName("should list synced MCP servers")
    void shouldListMcpServers() {
        try (var session = sessions.open()) {
            session.mcpServers().upsert(
                    new McpServer("mcp::catalog-test", null, McpServer.PROVIDER_ID, "http://mcp:8000/sse", null));
            session.commit();
        }

        given().when()
                .get("/api/mcp_servers")
                .then()
                .statusCode(200)
                .body("toolgroupId", hasItem("mcp::catalog-test"));
    }

    @Test
    @DisplayName("should list model servers and knowledge bases")
    void shouldListOtherCatalogs() {
        given().when().get("/api/model_servers").then().statusCode(200).body("$", hasSize(0));
        given().when().get("/api/knowledge_bases").then().statusCode(200).body("$", hasSize(0));
    }
}
