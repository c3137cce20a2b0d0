package com.netcracker.core.tagsync.service.diff;

import org.junit.jupiter.api.Test;

import static com.netcracker.core.tagsync.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class SubsetMatcherTest {

    @Test
    void emptyDesiredObjectAlwaysMatches() {
        assertThat(SubsetMatcher.matches(json("{a: 1, b: [1]}"), json("{}"))).isTrue();
        assertThat(SubsetMatcher.matches(json("{}"), json("{}"))).isTrue();
    }

    @Test
    void emptyCurrentMatchesOnlyDesiredWithoutKeys() {
        assertThat(SubsetMatcher.matches(json("{}"), json("{a: 1}"))).isFalse();
        assertThat(SubsetMatcher.matches(json("{}"), json("{a: null}"))).isFalse();
    }

    @Test
    void extraCurrentFieldsAreIgnored() {
        assertThat(SubsetMatcher.matches(json("{name: 'T', type: 'html', notes: 'x'}"),
                json("{name: 'T', type: 'html'}"))).isTrue();
    }

    @Test
    void scalarMismatchIsDetected() {
        assertThat(SubsetMatcher.matches(json("{type: 'html'}"), json("{type: 'img'}"))).isFalse();
        assertThat(SubsetMatcher.matches(json("{paused: false}"), json("{paused: true}"))).isFalse();
        assertThat(SubsetMatcher.matches(json("{a: 'x'}"), json("{a: {b: 'x'}}"))).isFalse();
    }

    @Test
    void numbersCompareByValue() {
        assertThat(SubsetMatcher.matches(json("{n: 1.0}"), json("{n: 1}"))).isTrue();
        assertThat(SubsetMatcher.matches(json("{n: '1'}"), json("{n: 1}"))).isFalse();
    }

    @Test
    void primitiveArraysAreSets() {
        assertThat(SubsetMatcher.matches(json("{tags: ['a', 'b', 'c']}"), json("{tags: ['b']}"))).isTrue();
        assertThat(SubsetMatcher.matches(json("{tags: ['c', 'a', 'a']}"), json("{tags: ['a', 'c']}"))).isTrue();
        assertThat(SubsetMatcher.matches(json("{tags: ['a']}"), json("{tags: ['b']}"))).isFalse();
    }

    @Test
    void emptyDesiredArrayAlwaysMatches() {
        assertThat(SubsetMatcher.matches(json("{tags: ['a']}"), json("{tags: []}"))).isTrue();
        assertThat(SubsetMatcher.matches(json("{}"), json("{tags: []}"))).isFalse();
    }

    @Test
    void keyedArraysMatchByKeyRegardlessOfOrder() {
        assertThat(SubsetMatcher.matches(
                json("{parameter: [{key: 'b', value: '2'}, {key: 'a', value: '1'}]}"),
                json("{parameter: [{key: 'a', value: '1'}]}"))).isTrue();
        assertThat(SubsetMatcher.matches(
                json("{parameter: [{key: 'a', value: '1'}, {key: 'b', value: '2'}]}"),
                json("{parameter: [{key: 'b', value: '2'}, {key: 'a', value: '1'}]}"))).isTrue();
        assertThat(SubsetMatcher.matches(
                json("{parameter: [{key: 'a', value: '1'}]}"),
                json("{parameter: [{key: 'a', value: '2'}]}"))).isFalse();
        assertThat(SubsetMatcher.matches(
                json("{parameter: [{key: 'A', value: '1'}]}"),
                json("{parameter: [{key: 'a', value: '1'}]}"))).isFalse();
    }

    @Test
    void namedArraysMatchByNameRegardlessOfOrder() {
        assertThat(SubsetMatcher.matches(
                json("{items: [{name: 'Other'}, {name: 'Page URL', value: 'x', extra: 1}]}"),
                json("{items: [{name: 'Page URL', value: 'x'}]}"))).isTrue();
        assertThat(SubsetMatcher.matches(
                json("{items: [{name: 'Other'}]}"),
                json("{items: [{name: 'Page URL'}]}"))).isFalse();
    }

    @Test
    void nameCaseChangeIsStillAMismatch() {
        assertThat(SubsetMatcher.matches(
                json("{items: [{name: 'Page URL', value: 'x'}]}"),
                json("{items: [{name: 'page url', value: 'x'}]}"))).isFalse();
    }

    @Test
    void unkeyedObjectArraysArePositional() {
        assertThat(SubsetMatcher.matches(
                json("{filter: [{type: 'equals', arg: 1}, {type: 'contains', arg: 2}]}"),
                json("{filter: [{type: 'equals'}, {type: 'contains'}]}"))).isTrue();
        assertThat(SubsetMatcher.matches(
                json("{filter: [{type: 'contains'}, {type: 'equals'}]}"),
                json("{filter: [{type: 'equals'}, {type: 'contains'}]}"))).isFalse();
        assertThat(SubsetMatcher.matches(
                json("{filter: [{type: 'equals'}, {type: 'contains'}]}"),
                json("{filter: [{type: 'equals'}]}"))).isFalse();
    }

    @Test
    void mixedIdentityFieldsFallBackToPositional() {
        assertThat(SubsetMatcher.matches(
                json("{list: [{key: 'a'}, {name: 'b'}]}"),
                json("{list: [{key: 'a'}, {name: 'b'}]}"))).isTrue();
        assertThat(SubsetMatcher.matches(
                json("{list: [{name: 'b'}, {key: 'a'}]}"),
                json("{list: [{key: 'a'}, {name: 'b'}]}"))).isFalse();
    }

    @Test
    void missingDesiredValueMatches() {
        assertThat(SubsetMatcher.matches(json("{a: 1}"), null)).isTrue();
    }
}
