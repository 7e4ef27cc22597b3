package com.example.catalogsync.source;

import com.example.catalogsync.exception.RemoteException;
import com.example.catalogsync.model.SourceRecord;

import java.util.List;

/**
 * Produces the complete, current list of source records of one entity family.
 * Records come back in a stable order; natural key uniqueness is checked by the caller.
 */
public interface SourceReader {

    /**
     * Name of the family the records belong to.
     */
    String getFamily();

    /**
     * @throws RemoteException when the source system cannot be read
     */
    List<SourceRecord> read();
}
