package com.mainframe.hlasm.model;

/**
 * Kind of a labelled block and of the chunk built from it.
 */
public enum ChunkType {
    SECTION,
    DATA_SECTION,
    SUBROUTINE,
    MACRO_DEF
}
