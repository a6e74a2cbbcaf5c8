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

package exm.pylower.common.lang;

import exm.pylower.common.exceptions.InvalidLiteralException;

/**
 * Turns literal token text into the value the reference front end
 * would produce for it.
 */
public interface LiteralEvaluator {

  /**
   * @param text NUMBER token text, e.g. "0x_ff", "1.5e3", "2j"
   * @return a BigInteger, Double or Imaginary
   */
  public Object evalNumber(String text) throws InvalidLiteralException;

  /**
   * @param text a single STRING token including prefix and quotes
   * @return a String, or Bytes for a bytes literal
   */
  public Object evalString(String text) throws InvalidLiteralException;
}
