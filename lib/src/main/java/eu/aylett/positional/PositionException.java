/*
 * Copyright 2026 Andrew Aylett
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

package eu.aylett.positional;

/**
 * Base class for the ways a {@link Position} handed to a
 * {@link PositionalList} can fail validation. Validation happens before any
 * change to the list, so a list that throws one of these is unmodified.
 */
public abstract class PositionException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  protected PositionException(String message) {
    super(message);
  }
}
