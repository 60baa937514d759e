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

import static java.lang.String.format;

public class RuntimeFilterTransportException
        extends RuntimeException
{
    private final URI location;
    private final int statusCode;

    public RuntimeFilterTransportException(URI location, int statusCode)
    {
        super(format("Request to %s failed with status %s", location, statusCode));
        this.location = location;
        this.statusCode = statusCode;
    }

    public URI getLocation()
    {
        return location;
    }

    public int getStatusCode()
    {
        return statusCode;
    }
}
