package io.github.goodees.ledger.core.matching;

/*-
 * #%L
 * ledger-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
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
 * #L%
 */

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TypeSwitchTest {
    private final List<String> matched = new ArrayList<>();

    @Test
    public void first_matching_branch_wins() {
        TypeSwitch sw = TypeSwitch.builder()
                .on(Integer.class, (i) -> matched.add("int " + i))
                .on(Number.class, (n) -> matched.add("number " + n))
                .build();
        assertTrue(sw.executeMatching(1));
        assertTrue(sw.executeMatching(2L));
        assertEquals("int 1", matched.get(0));
        assertEquals("number 2", matched.get(1));
    }

    @Test
    public void predicate_restricts_branch() {
        TypeSwitch sw = TypeSwitch.builder()
                .on(String.class, String::isEmpty, (s) -> matched.add("empty"))
                .on(String.class, (s) -> matched.add(s))
                .build();
        sw.executeMatching("");
        sw.executeMatching("text");
        assertEquals(2, matched.size());
        assertEquals("empty", matched.get(0));
        assertEquals("text", matched.get(1));
    }

    @Test
    public void fallback_is_applied_last() {
        TypeSwitch sw = TypeSwitch.builder()
                .otherwise((o) -> matched.add("other"))
                .on(String.class, (s) -> matched.add(s))
                .build();
        sw.executeMatching("text");
        sw.executeMatching(1);
        assertEquals("text", matched.get(0));
        assertEquals("other", matched.get(1));
    }

    @Test
    public void reports_no_match() {
        TypeSwitch sw = TypeSwitch.builder().on(String.class, (s) -> matched.add(s)).build();
        assertFalse(sw.executeMatching(1));
        assertFalse(sw.executeMatching(null));
        assertTrue(matched.isEmpty());
    }
}
