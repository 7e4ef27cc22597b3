package com.example.catalogsync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration class for the metadata catalog API.
 * Manages base URL, database, authentication details, proxy settings and the scheme holding the technical datatypes.
 */
@Configuration
public class CatalogApiConfig {

    @Value("${catalog.base-url:}")
    private String baseUrl;

    @Value("${catalog.database:prod}")
    private String database;

    @Value("${catalog.username:}")
    private String username;

    @Value("${catalog.password:}")
    private String password;

    @Value("${catalog.proxy.enabled:false}")
    private boolean proxyEnabled;

    @Value("${catalog.proxy.host:}")
    private String proxyHost;

    @Value("${catalog.proxy.port:8080}")
    private int proxyPort;

    @Value("${catalog.proxy.username:}")
    private String proxyUsername;

    @Value("${catalog.proxy.password:}")
    private String proxyPassword;

    @Value("${catalog.datatype-scheme:Datentypen (technisch)}")
    private String datatypeScheme;

    @Value("${catalog.connection.timeout:30000}")
    private int connectionTimeout;

    @Value("${catalog.read.timeout:60000}")
    private int readTimeout;

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean isProxyEnabled() {
        return proxyEnabled;
    }

    public String getProxyHost() {
        return proxyHost;
    }

    public int getProxyPort() {
        return proxyPort;
    }

    public String getProxyUsername() {
        return proxyUsername;
    }

    public String getProxyPassword() {
        return proxyPassword;
    }

    public String getDatatypeScheme() {
        return datatypeScheme;
    }

    public int getConnectionTimeout() {
        return connectionTimeout;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    /**
     * Get the REST API path prefix for the configured database
     */
    public String getRestPath() {
        return "/rest/" + database;
    }

    /**
     * Check if the catalog integration is configured
     */
    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isEmpty()
               && username != null && !username.isEmpty()
               && password != null && !password.isEmpty();
    }
}
