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

import io.sluice.common.QueryId;
import io.sluice.execution.filter.RuntimeFilterCoordinator;

import javax.inject.Inject;
import javax.ws.rs.Consumes;
import javax.ws.rs.DELETE;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static javax.ws.rs.core.MediaType.APPLICATION_JSON;

@Path("/v1/query/{queryId}/runtimeFilter")
public class CoordinatorRuntimeFilterResource
{
    private final RuntimeFilterCoordinator coordinator;

    @Inject
    public CoordinatorRuntimeFilterResource(RuntimeFilterCoordinator coordinator)
    {
        this.coordinator = requireNonNull(coordinator, "coordinator is null");
    }

    @POST
    @Consumes(APPLICATION_JSON)
    public void updateFilter(@PathParam("queryId") QueryId queryId, FilterUpdateRequest request)
    {
        requireNonNull(queryId, "queryId is null");
        requireNonNull(request, "request is null");
        checkArgument(queryId.equals(request.getQueryId()), "Update for query %s was sent to query %s", request.getQueryId(), queryId);
        coordinator.updateFilter(request);
    }

    @DELETE
    public void removeQuery(@PathParam("queryId") QueryId queryId)
    {
        requireNonNull(queryId, "queryId is null");
        coordinator.removeQuery(queryId);
    }
}
