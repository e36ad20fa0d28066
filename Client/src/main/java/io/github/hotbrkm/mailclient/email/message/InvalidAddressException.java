package io.github.hotbrkm.mailclient.email.message;

import lombok.Getter;

/**
 * Thrown when a mail address cannot be parsed as an RFC 5322 address.
 */
@Getter
public class InvalidAddressException extends IllegalArgumentException {

    private final AddressHeader header;
    private final String address;

    public InvalidAddressException(AddressHeader header, String address, Throwable cause) {
        super("failed to parse " + header + " address \"" + address + "\": " + cause.getMessage(), cause);
        this.header = header;
        this.address = address;
    }
}
