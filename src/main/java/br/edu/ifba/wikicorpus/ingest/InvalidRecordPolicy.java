package br.edu.ifba.wikicorpus.ingest;

/**
 * What an import does with a record that fails validation.
 */
public enum InvalidRecordPolicy {
    /** Log the record and leave it out of the import. */
    SKIP,
    /** Fail the whole import with the validation error. */
    ABORT
}
