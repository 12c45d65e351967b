/*
 * Copyright 2021-present StarRocks, Inc. All rights reserved.
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.starrocks.data.load.backend.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starrocks.data.load.backend.LoadContext;
import com.starrocks.data.load.backend.exception.EngineBackendException;
import com.starrocks.data.load.backend.model.TableInfo;
import com.starrocks.data.load.backend.properties.BackendProperties;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.DefaultRedirectStrategy;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads table models from the status port of the target, for backends implementing
 * {@code AbstractBackend#fetchRemoteTableModels}.
 */
public class RemoteSchemaClient implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteSchemaClient.class);

    private static final String SCHEMA_PATH_SEGMENT = "schema";

    private final String statusUrl;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RemoteSchemaClient(BackendProperties properties) {
        if (properties.getStatusUrl() == null) {
            throw new IllegalArgumentException("statusUrl is required to fetch remote table models");
        }
        this.statusUrl = properties.getStatusUrl().endsWith("/")
                ? properties.getStatusUrl().substring(0, properties.getStatusUrl().length() - 1)
                : properties.getStatusUrl();
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(properties.getConnectTimeoutMs())
                .setSocketTimeout(properties.getSocketTimeoutMs())
                .build();
        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .setRedirectStrategy(new DefaultRedirectStrategy() {
                    @Override
                    protected boolean isRedirectable(String method) {
                        return true;
                    }
                })
                .build();
        this.objectMapper = new ObjectMapper();
        // the server reports more fields than TableInfo keeps
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<TableInfo> fetchTableModels(LoadContext ctx, String schema) {
        ctx.checkCancelled();
        Pair<Integer, String> response;
        try {
            response = get(schemaUri(schema));
        } catch (IOException e) {
            throw new EngineBackendException(String.format("cannot read schema '%s' from remote", schema), e);
        }

        int code = response.getKey();
        if (code != 200) {
            // 5xx may be a restarting server, 4xx will not change by asking again
            throw new EngineBackendException(String.format("cannot read schema '%s' from remote, " +
                    "http code: %d, body: %s", schema, code, response.getValue()), code >= 500);
        }

        List<TableInfo> tables;
        try {
            tables = objectMapper.readValue(response.getValue(), new TypeReference<List<TableInfo>>() {});
        } catch (Exception e) {
            throw new EngineBackendException(String.format("cannot read schema '%s' from remote, " +
                    "invalid body: %s", schema, response.getValue()), e, false);
        }
        LOG.info("Fetched {} table models of schema {} from {}", tables.size(), schema, statusUrl);
        return tables;
    }

    /**
     * {@code <statusUrl>/schema/<schema>}, with the schema name percent-encoded as one path
     * segment.
     */
    URI schemaUri(String schema) {
        try {
            URIBuilder builder = new URIBuilder(statusUrl);
            List<String> segments = new ArrayList<>();
            for (String segment : builder.getPathSegments()) {
                if (!segment.isEmpty()) {
                    segments.add(segment);
                }
            }
            segments.add(SCHEMA_PATH_SEGMENT);
            segments.add(schema);
            return builder.setPathSegments(segments).build();
        } catch (URISyntaxException e) {
            throw new EngineBackendException(String.format("cannot read schema '%s' from remote, " +
                    "invalid status url: %s", schema, statusUrl), e, false);
        }
    }

    private Pair<Integer, String> get(URI uri) throws IOException {
        HttpGet httpGet = new HttpGet(uri);
        try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
            int code = response.getStatusLine().getStatusCode();
            String body = response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : null;
            return Pair.of(code, body);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
