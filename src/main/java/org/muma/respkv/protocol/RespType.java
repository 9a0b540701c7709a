package org.muma.respkv.protocol;

/**
 * RESP 类型标识，由帧的第一个字节决定
 */
public enum RespType {
    SIMPLE_STRING((byte) '+'),
    ERROR((byte) '-'),
    INTEGER((byte) ':'),
    BULK_STRING((byte) '$'),
    ARRAY((byte) '*');

    private final byte tag;

    RespType(byte tag) {
        this.tag = tag;
    }

    public byte tag() {
        return tag;
    }

    public static RespType fromTag(byte tag) {
        for (RespType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        throw new RespException(RespError.UNSUPPORTED_TYPE, "Unsupported RESP type: " + (tag & 0xFF));
    }
}
