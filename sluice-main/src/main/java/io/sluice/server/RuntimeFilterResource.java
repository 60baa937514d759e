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
import io.sluice.execution.filter.RuntimeFilterBankManager;

import javax.inject.Inject;
import javax.ws.rs.Consumes;
import javax.ws.rs.DELETE;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;

import static java.util.Objects.requireNonNull;
import static javax.ws.rs.core.MediaType.APPLICATION_JSON;

/**
 * Receives aggregated filters from the coordinator. Filters for queries that are no longer
 * running on this worker are dropped. Deleting a query closes its bank and frees its filter memory.
 */
@Path("/v1/runtimeFilter/{queryId}")
public class RuntimeFilterResource
{
    private final RuntimeFilterBankManager bankManager;

    @Inject
    public RuntimeFilterResource(RuntimeFilterBankManager bankManager)
    {
        this.bankManager = requireNonNull(bankManager, "bankManager is null");
    }

    @POST
    @Consumes(APPLICATION_JSON)
    public void publishFilter(@PathParam("queryId") QueryId queryId, PublishFilterRequest request)
    {
        requireNonNull(queryId, "queryId is null");
        requireNonNull(request, "request is null");
        bankManager.publishGlobalFilter(queryId, request);
    }

    @DELETE
    public void removeQuery(@PathParam("queryId") QueryId queryId)
    {
        requireNonNull(queryId, "queryId is null");
        bankManager.removeBank(queryId);
    }
}
