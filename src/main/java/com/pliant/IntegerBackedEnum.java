/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.pliant;

/**
 * Implemented by {@link Enum} types whose members carry an integer value.
 * <p>
 * Members of such enums can be converted from integers, or from text naming either the member or its value.
 * <pre>{@code  public enum Priority implements IntegerBackedEnum {
 *   LOW(1), HIGH(2);
 *
 *   private final int value;
 *
 *   Priority(int value) { this.value = value; }
 *
 *   @Override
 *   public int getValue() { return this.value; }
 * }}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface IntegerBackedEnum {
	/**
	 * The integer value of this member.
	 *
	 * @return the value
	 */
	int getValue();
}
