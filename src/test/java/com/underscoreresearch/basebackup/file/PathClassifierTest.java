package com.underscoreresearch.basebackup.file;

import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Set;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.underscoreresearch.basebackup.model.FileClassification;

class PathClassifierTest {
    private static final Set<String> SIBLINGS = Set.of("16384", "16384_init", "16385", "16385_vm");

    @ParameterizedTest
    @CsvSource({
            "postmaster.pid,true,EXCLUDE_FILE",
            "base/1/pg_internal.init,true,EXCLUDE_FILE",
            "base/1/pg_internal.init.123,true,EXCLUDE_FILE",
            "base/pgsql_tmp,true,EXCLUDE_FILE",
            "backup_label,true,EXCLUDE_FILE",
            "pg_wal/000000010000000000000001,true,EXCLUDE_DIR",
            "pg_replslot/slot1,true,EXCLUDE_DIR",
            "pg_stat_tmp/global.stat,true,EXCLUDE_DIR",
            "pg_wal,true,INCLUDE",
            "base/5/t888_888,true,TEMP_RELATION",
            "base/5/t888888_888888_vm.1,true,TEMP_RELATION",
            "base/5/16384,true,UNLOGGED_NONINIT_FORK",
            "base/5/16384_init,true,INCLUDE",
            "base/5/16384.1,true,UNLOGGED_NONINIT_FORK",
            "base/5/16385,true,INCLUDE",
            "global/16384,true,INCLUDE",
            "PG_16_202307071/5/t888_888,false,TEMP_RELATION",
            "PG_16_202307071/5/16384_vm,false,UNLOGGED_NONINIT_FORK",
            "PG_16_202307071/5/pg_wal,false,INCLUDE",
            "pg_wal/x,false,INCLUDE"
    })
    public void testClassify(String path, boolean dataDirectory, FileClassification expected) {
        assertThat(PathClassifier.classify(path, dataDirectory, SIBLINGS::contains), Is.is(expected));
    }

    @Test
    public void testSkipsContents() {
        assertThat(PathClassifier.skipsContents("pg_wal", true), Is.is(true));
        assertThat(PathClassifier.skipsContents("pg_replslot", true), Is.is(true));
        assertThat(PathClassifier.skipsContents("base", true), Is.is(false));
        assertThat(PathClassifier.skipsContents("pg_wal", false), Is.is(false));
    }

    @Test
    public void testChecksummed() {
        assertThat(PathClassifier.isChecksummed("base/5/16384", true), Is.is(true));
        assertThat(PathClassifier.isChecksummed("global/1262", true), Is.is(true));
        assertThat(PathClassifier.isChecksummed("global/pg_control", true), Is.is(false));
        assertThat(PathClassifier.isChecksummed("base/5/PG_VERSION", true), Is.is(false));
        assertThat(PathClassifier.isChecksummed("pg_xact/0000", true), Is.is(false));
        assertThat(PathClassifier.isChecksummed("PG_16_202307071/5/16384", false), Is.is(true));
    }

    @Test
    public void testSegmentNumber() {
        assertThat(PathClassifier.segmentNumber("16384"), Is.is(0));
        assertThat(PathClassifier.segmentNumber("16384.3"), Is.is(3));
        assertThat(PathClassifier.segmentNumber("16384.0"), Is.is(-1));
        assertThat(PathClassifier.segmentNumber("16384.a"), Is.is(-1));
    }

    @Test
    public void testPathHelpers() {
        assertThat(PathClassifier.fileName("base/5/16384"), Is.is("16384"));
        assertThat(PathClassifier.parent("base/5/16384"), Is.is("base/5"));
        assertThat(PathClassifier.parent("base"), Is.is((String) null));
        assertThat(PathClassifier.child("", "base"), Is.is("base"));
        assertThat(PathClassifier.child("base", "5"), Is.is("base/5"));
    }
}
