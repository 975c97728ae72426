package com.kvrestore.connector;

import java.time.Instant;

/** A listing entry of a {@link BlobStore}. */
public record BlobObject(String key, long size, Instant lastModified) {}
