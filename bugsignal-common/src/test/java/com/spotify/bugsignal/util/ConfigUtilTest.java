/*-
 * -\-\-
 * BugSignal Common
 * --
 * Copyright (C) 2024 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */
package com.spotify.bugsignal.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.spotify.bugsignal.testing.ClassEnforcer;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Optional;
import org.junit.Test;

public class ConfigUtilTest {

  private final Config config = ConfigFactory.parseString(
      "a.string = foo\n"
      + "a.blank = \"  \"\n"
      + "a.duration = 2500ms\n"
      + "a.count = 3\n"
      + "a.zero = 0\n");

  @Test
  public void shouldNotBeInstantiable() throws ReflectiveOperationException {
    assertThat(ClassEnforcer.assertNotInstantiable(ConfigUtil.class), is(true));
  }

  @Test
  public void shouldGetStringWithDefault() {
    assertThat(ConfigUtil.get(config, "a.string", "bar"), is("foo"));
    assertThat(ConfigUtil.get(config, "a.missing", "bar"), is("bar"));
  }

  @Test
  public void shouldTreatBlankStringAsMissing() {
    assertThat(ConfigUtil.getString(config, "a.string"), is(Optional.of("foo")));
    assertThat(ConfigUtil.getString(config, "a.blank"), is(Optional.empty()));
    assertThat(ConfigUtil.getString(config, "a.missing"), is(Optional.empty()));
  }

  @Test
  public void shouldGetDuration() {
    assertThat(ConfigUtil.getDuration(config, "a.duration", Duration.ZERO), is(Duration.ofMillis(2500)));
    assertThat(ConfigUtil.getDuration(config, "a.missing", Duration.ofSeconds(5)), is(Duration.ofSeconds(5)));
  }

  @Test
  public void shouldGetPositiveInt() {
    assertThat(ConfigUtil.getPositiveInt(config, "a.count", 8), is(3));
    assertThat(ConfigUtil.getPositiveInt(config, "a.missing", 8), is(8));
    assertThrows(IllegalArgumentException.class, () -> ConfigUtil.getPositiveInt(config, "a.zero", 8));
  }
}
