package com.underscoreresearch.basebackup.output;

import java.io.IOException;
import java.util.List;

import com.underscoreresearch.basebackup.model.OutputFormat;
import com.underscoreresearch.basebackup.model.Tablespace;

/**
 * Where the archives of a backup end up.
 */
public interface OutputTarget {
    /**
     * Checks and creates the output locations. Nothing else is called before this succeeded.
     */
    void prepare(List<Tablespace> tablespaces) throws IOException;

    /**
     * {@link OutputFormat#PLAIN} when archives are extracted while written, which keeps
     * tablespace links in the main archive instead of a tablespace map.
     */
    OutputFormat getFormat();

    OutputArchive openBaseArchive() throws IOException;

    OutputArchive openTablespaceArchive(Tablespace tablespace) throws IOException;

    /**
     * Archive for streamed WAL. Plain output writes it straight into the WAL directory.
     */
    OutputArchive openWalArchive() throws IOException;

    /**
     * Where the link of a tablespace in the main archive points to.
     */
    String tablespaceLinkTarget(Tablespace tablespace);

    boolean writesManifest();

    void writeManifest(byte[] manifest) throws IOException;

    void sync() throws IOException;

    /**
     * Removes what a failed backup left behind.
     *
     * @param keep Only report what would have been removed.
     */
    void cleanup(boolean keep);
}
