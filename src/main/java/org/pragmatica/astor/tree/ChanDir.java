package org.pragmatica.astor.tree;

/**
 * Direction of a channel type.
 */
public enum ChanDir {
    SEND,
    RECV,
    BOTH
}
