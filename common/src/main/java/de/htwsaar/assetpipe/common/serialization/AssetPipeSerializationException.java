package de.htwsaar.assetpipe.common.serialization;

public class AssetPipeSerializationException extends RuntimeException {

    public AssetPipeSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
