package io.nosqlbench.biosynth;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.platform.suite.api.ExcludeTags;
import org.junit.platform.suite.api.SelectPackages;
import org.junit.platform.suite.api.Suite;

/// Test suite for the generators module.
///
/// Runs every generator test except those tagged `accuracy`, which render
/// long records to estimate spectra and rhythm statistics and are run by
/// [AccuracySuite].
@Suite
@SelectPackages("io.nosqlbench.biosynth")
@ExcludeTags("accuracy")
public class GeneratorsSuite {
    // This class is just a container for the suite annotations
}
