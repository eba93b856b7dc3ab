package com.underscoreresearch.basebackup.model;

public enum CompressionLocation {
    CLIENT,
    SERVER
}
