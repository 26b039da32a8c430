/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.symbolic.integrate;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = ImmutableMap.of();
    assertThat(Prop.MAX_DEPTH.intValue(map), is(10));
    assertThat(Prop.MAX_DISPATCHES.intValue(map), is(500));
    assertThat(Prop.RISCH_ENABLED.booleanValue(map), is(true));
    assertThat(Prop.VERIFY.booleanValue(map), is(false));
    assertThat(Prop.TIMEOUT_MILLIS.intValue(map), is(0));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.MAX_DEPTH.set(map, 3);
    assertThat(Prop.MAX_DEPTH.intValue(map), is(3));
    assertThat(Prop.MAX_DEPTH.get(map), is((Object) 3));
    assertThat(Prop.VERIFY.get(map), is((Object) false));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.MAX_DEPTH.set(map, "3"));
    assertThat(e.getMessage(),
        is("value for property maxDepth must have type "
            + "class java.lang.Integer"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.set(map, null));
  }

  @Test void testValidate() {
    final Map<Prop, Object> map =
        Prop.validate(ImmutableMap.of(Prop.VERIFY, true, Prop.MAX_DEPTH, 4));
    assertThat(map.size(), is(2));
    assertThat(Prop.VERIFY.booleanValue(map), is(true));
    assertThat(Prop.MAX_DEPTH.intValue(map), is(4));
    assertThat(Prop.validate(ImmutableMap.of()).isEmpty(), is(true));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.validate(ImmutableMap.of(Prop.RISCH_ENABLED, "false")));
  }

  /** Asking for a value of the wrong type is an error. */
  @Test void testWrongType() {
    final Map<Prop, Object> map = ImmutableMap.of();
    assertThrows(IllegalArgumentException.class,
        () -> Prop.VERIFY.intValue(map));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.booleanValue(map));
  }
}

// End PropTest.java
