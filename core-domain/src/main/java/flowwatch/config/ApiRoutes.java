package flowwatch.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/api/v1";

    // Rutas específicas
    public static final String GAUGES = CURRENT_VERSION + "/gauges";
    public static final String PIPELINE = CURRENT_VERSION + "/pipeline";

    // Rutas públicas
    public static final String API_DOCS = CURRENT_VERSION + "/api-docs";
    public static final String SWAGGER_UI = CURRENT_VERSION + "/swagger-ui";
}
