/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sluice.server;

import io.airlift.http.client.HttpClient;
import io.airlift.http.client.HttpStatus.Family;
import io.airlift.http.client.Request;
import io.airlift.json.JsonCodec;
import io.sluice.common.QueryId;

import javax.inject.Inject;

import java.net.URI;

import static com.google.common.net.HttpHeaders.CONTENT_TYPE;
import static com.google.common.net.MediaType.JSON_UTF_8;
import static io.airlift.http.client.HttpStatus.familyForStatusCode;
import static io.airlift.http.client.HttpUriBuilder.uriBuilderFrom;
import static io.airlift.http.client.JsonBodyGenerator.jsonBodyGenerator;
import static io.airlift.http.client.Request.Builder.preparePost;
import static io.airlift.http.client.StatusResponseHandler.StatusResponse;
import static io.airlift.http.client.StatusResponseHandler.createStatusResponseHandler;
import static java.util.Objects.requireNonNull;

/**
 * Ships filter updates to the coordinator and aggregated filters to the workers over HTTP.
 */
public class HttpRuntimeFilterClient
        implements FilterUpdateClient, FilterPublishClient
{
    private final HttpClient httpClient;
    private final JsonCodec<FilterUpdateRequest> filterUpdateCodec;
    private final JsonCodec<PublishFilterRequest> publishFilterCodec;

    @Inject
    public HttpRuntimeFilterClient(
            @ForRuntimeFilter HttpClient httpClient,
            JsonCodec<FilterUpdateRequest> filterUpdateCodec,
            JsonCodec<PublishFilterRequest> publishFilterCodec)
    {
        this.httpClient = requireNonNull(httpClient, "httpClient is null");
        this.filterUpdateCodec = requireNonNull(filterUpdateCodec, "filterUpdateCodec is null");
        this.publishFilterCodec = requireNonNull(publishFilterCodec, "publishFilterCodec is null");
    }

    @Override
    public void sendFilterUpdate(URI coordinatorLocation, FilterUpdateRequest request)
    {
        URI uri = uriBuilderFrom(coordinatorLocation)
                .appendPath("/v1/query")
                .appendPath(request.getQueryId().toString())
                .appendPath("runtimeFilter")
                .build();
        execute(preparePost()
                .setUri(uri)
                .setHeader(CONTENT_TYPE, JSON_UTF_8.toString())
                .setBodyGenerator(jsonBodyGenerator(filterUpdateCodec, request))
                .build());
    }

    @Override
    public void publishFilter(URI workerLocation, QueryId queryId, PublishFilterRequest request)
    {
        URI uri = uriBuilderFrom(workerLocation)
                .appendPath("/v1/runtimeFilter")
                .appendPath(queryId.toString())
                .build();
        execute(preparePost()
                .setUri(uri)
                .setHeader(CONTENT_TYPE, JSON_UTF_8.toString())
                .setBodyGenerator(jsonBodyGenerator(publishFilterCodec, request))
                .build());
    }

    private void execute(Request request)
    {
        StatusResponse response = httpClient.execute(request, createStatusResponseHandler());
        if (familyForStatusCode(response.getStatusCode()) != Family.SUCCESSFUL) {
            throw new RuntimeFilterTransportException(request.getUri(), response.getStatusCode());
        }
    }
}
