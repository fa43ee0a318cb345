// Copyright (c) Keith D Gregory
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.kdgregory.logrouter.cloudwatch;


/**
 *  Picks the destination for a source. Hosts that derive names from source
 *  metadata provide their own implementation; {@link DefaultNameResolver} uses
 *  fixed names from configuration.
 */
public interface NameResolver
{
    Destination resolve(String sourceId);
}
