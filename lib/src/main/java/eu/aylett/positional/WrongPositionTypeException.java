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
 * Thrown when a {@link Position} implementation that was not issued by a
 * {@link PositionalList} is passed to one.
 */
public class WrongPositionTypeException extends PositionException {
  private static final long serialVersionUID = 1L;

  public WrongPositionTypeException(Position<?> position) {
    super("Position must be one issued by a PositionalList, got " + position.getClass().getName());
  }
}
