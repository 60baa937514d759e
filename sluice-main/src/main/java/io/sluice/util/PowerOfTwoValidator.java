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
package io.sluice.util;

import io.airlift.units.DataSize;

import javax.validation.ConstraintValidator;
import javax.validation.ConstraintValidatorContext;

import static com.google.common.math.LongMath.isPowerOfTwo;

public class PowerOfTwoValidator
        implements ConstraintValidator<PowerOfTwo, DataSize>
{
    @Override
    public void initialize(PowerOfTwo constraintAnnotation) {}

    @Override
    public boolean isValid(DataSize value, ConstraintValidatorContext context)
    {
        return value == null || isPowerOfTwo(value.toBytes());
    }
}
