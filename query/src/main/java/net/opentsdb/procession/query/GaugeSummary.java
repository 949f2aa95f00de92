/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.opentsdb.procession.query;

import net.opentsdb.procession.core.Op;

/** Running statistics for one gauge. Add and Sub move the latest value, Set replaces it. */
public class GaugeSummary {

  private double min;
  private double max;
  private double avg;
  private double latest;
  private long count;

  void track(final Op op, final double value) {
    switch (op) {
      case ADD:
        latest += value;
        break;
      case SUB:
        latest -= value;
        break;
      default:
        latest = value;
    }
    if (count == 0) {
      min = latest;
      max = latest;
    } else {
      min = Math.min(min, latest);
      max = Math.max(max, latest);
    }
    count++;
    avg += (latest - avg) / count;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public double getAvg() {
    return avg;
  }

  public double getLatest() {
    return latest;
  }

  public long getCount() {
    return count;
  }
}
