package assistant.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.Authenticated;
import io.smallrye.mutiny.Uni;

import assistant.core.model.sync.KnowledgeBase;
import assistant.core.model.sync.McpServer;
import assistant.core.model.sync.ModelServer;
import assistant.core.port.in.ResourceCatalog;

/**
 * Read-only listing of the resources synced from llama-stack at startup.
 */
@Path("/api")
@ApplicationScoped
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
public class CatalogResource {

    private final ResourceCatalog catalog;

    @Inject
    public CatalogResource(ResourceCatalog catalog) {
        this.catalog = catalog;
    }

    @GET
    @Path("/mcp_servers")
    public Uni<List<McpServer>> mcpServers() {
        return catalog.mcpServers();
    }

    @GET
    @Path("/model_servers")
    public Uni<List<ModelServer>> modelServers() {
        return catalog.modelServers();
    }

    @GET
    @Path("/knowledge_bases")
    public Uni<List<KnowledgeBase>> knowledgeBases() {
        return catalog.knowledgeBases();
    }
}
