/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
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
 * limitations under the License
 */

package exm.pylower.common.exceptions;

/**
 * No lowering routine is registered for a parse tree kind.
 */
public class UnimplementedConstructException extends PyLowerRuntimeError {

  private final String kindName;

  public UnimplementedConstructException(String kindName) {
    super("No lowering for " + kindName);
    this.kindName = kindName;
  }

  public String kindName() {
    return kindName;
  }

  private static final long serialVersionUID = 8171925405232781651L;
}
