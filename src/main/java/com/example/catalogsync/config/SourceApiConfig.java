package com.example.catalogsync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration class for the open-data portal (ODS explore API v2.1) the source records are read from.
 */
@Configuration
public class SourceApiConfig {

    @Value("${ods.base-url:https://data.bs.ch}")
    private String baseUrl;

    @Value("${ods.page-size:100}")
    private int pageSize;

    @Value("${ods.connection.timeout:30000}")
    private int connectionTimeout;

    @Value("${ods.read.timeout:120000}")
    private int readTimeout;

    @Value("${ods.org-units.dataset-id:100349}")
    private String orgUnitsDatasetId;

    @Value("${ods.laws.dataset-id:100354}")
    private String lawsDatasetId;

    @Value("${ods.laws.filter:is_active=true AND info_badge='current'}")
    private String lawsFilter;

    @Value("${ods.datasets.filter:}")
    private String datasetsFilter;

    @Value("${ods.dataset-link-template:https://data.bs.ch/explore/dataset/%s/}")
    private String datasetLinkTemplate;

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getConnectionTimeout() {
        return connectionTimeout;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    public String getOrgUnitsDatasetId() {
        return orgUnitsDatasetId;
    }

    public String getLawsDatasetId() {
        return lawsDatasetId;
    }

    public String getLawsFilter() {
        return lawsFilter;
    }

    public String getDatasetsFilter() {
        return datasetsFilter;
    }

    /**
     * Public portal link of a dataset
     */
    public String getDatasetLink(String datasetId) {
        return String.format(datasetLinkTemplate, datasetId);
    }

    /**
     * Get the explore API URL
     */
    public String getExploreApiUrl() {
        return baseUrl + "/api/explore/v2.1";
    }
}
