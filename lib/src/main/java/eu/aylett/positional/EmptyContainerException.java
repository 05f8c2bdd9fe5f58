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

import java.util.NoSuchElementException;

/**
 * Thrown when an element is read or removed from a container that holds no
 * elements.
 * <p>
 * Emptiness is always detected before any change is made, so the container is
 * left as it was.
 */
public class EmptyContainerException extends NoSuchElementException {
  private static final long serialVersionUID = 1L;

  public EmptyContainerException(String message) {
    super(message);
  }
}
