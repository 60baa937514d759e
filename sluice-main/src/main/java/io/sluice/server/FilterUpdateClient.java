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

import java.net.URI;

public interface FilterUpdateClient
{
    /**
     * Sends the update to the coordinator and waits for it to be accepted.
     *
     * @throws RuntimeFilterTransportException if the coordinator rejects the update
     */
    void sendFilterUpdate(URI coordinatorLocation, FilterUpdateRequest request);
}
