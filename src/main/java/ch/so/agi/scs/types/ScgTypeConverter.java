package ch.so.agi.scs.types;

import java.util.Optional;

/** Maps SCg type descriptors to their SCs counterparts. */
public interface ScgTypeConverter {

    /** SCs type keyword for a node or bus type, e.g. {@code sc_node_tuple}. */
    Optional<String> nodeTypeKeyword(String scgType);

    /** SCs connector designation for a connector type, e.g. {@code ->}. */
    Optional<String> connectorDesignation(String scgType);
}
