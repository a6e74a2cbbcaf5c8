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

import exm.pylower.common.exceptions.InvalidOptionException;

/**
 * A Python 3 release, as (major, minor), that produced trees must be
 * valid for.  Immutable.
 */
public class TargetVersion implements Comparable<TargetVersion> {

  public static final int MAJOR = 3;
  public static final int MAX_MINOR = 13;

  public static final TargetVersion PY3_0 = new TargetVersion(3, 0);
  public static final TargetVersion LATEST = new TargetVersion(3, MAX_MINOR);

  public final int major;
  public final int minor;

  private TargetVersion(int major, int minor) {
    this.major = major;
    this.minor = minor;
  }

  public static TargetVersion of(int major, int minor) {
    assert(major == MAJOR && minor >= 0 && minor <= MAX_MINOR) :
          major + "." + minor;
    return new TargetVersion(major, minor);
  }

  /**
   * @param text version such as "3.12"
   */
  public static TargetVersion parse(String text) throws InvalidOptionException {
    if (text == null) {
      throw new InvalidOptionException("No target version given");
    }
    String trimmed = text.trim();
    int dot = trimmed.indexOf('.');
    if (dot < 0) {
      throw new InvalidOptionException("Target version must be MAJOR.MINOR, " +
                                       "got \"" + text + "\"");
    }
    int major, minor;
    try {
      major = Integer.parseInt(trimmed.substring(0, dot));
      minor = Integer.parseInt(trimmed.substring(dot + 1));
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Target version must be MAJOR.MINOR, " +
                                       "got \"" + text + "\"");
    }
    if (major != MAJOR || minor < 0 || minor > MAX_MINOR) {
      throw new InvalidOptionException("Unsupported target version " + text +
            ": expected " + PY3_0 + " through " + LATEST);
    }
    return new TargetVersion(major, minor);
  }

  public boolean atLeast(TargetVersion other) {
    return compareTo(other) >= 0;
  }

  @Override
  public int compareTo(TargetVersion o) {
    if (major != o.major) {
      return major < o.major ? -1 : 1;
    }
    if (minor != o.minor) {
      return minor < o.minor ? -1 : 1;
    }
    return 0;
  }

  @Override
  public int hashCode() {
    return major * 31 + minor;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof TargetVersion))
      return false;
    TargetVersion other = (TargetVersion) obj;
    return major == other.major && minor == other.minor;
  }

  @Override
  public String toString() {
    return major + "." + minor;
  }
}
