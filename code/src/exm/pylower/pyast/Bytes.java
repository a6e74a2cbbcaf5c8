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

package exm.pylower.pyast;

import java.util.Arrays;

/**
 * Immutable value of a bytes literal
 */
public final class Bytes {
  private final byte[] data;

  public Bytes(byte[] data) {
    this.data = data.clone();
  }

  public int length() {
    return data.length;
  }

  /**
   * @return byte at index i, as an unsigned value
   */
  public int get(int i) {
    return data[i] & 0xff;
  }

  public byte[] toArray() {
    return data.clone();
  }

  /**
   * @return this followed by other
   */
  public Bytes concat(Bytes other) {
    byte[] result = Arrays.copyOf(data, data.length + other.data.length);
    System.arraycopy(other.data, 0, result, data.length, other.data.length);
    return new Bytes(result);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(data);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Bytes)) {
      return false;
    }
    return Arrays.equals(data, ((Bytes)obj).data);
  }

  @Override
  public String toString() {
    return AstDump.reprBytes(this);
  }
}
