package sten.steganography.controller;

import picocli.CommandLine.ITypeConverter;
import sten.steganography.crypto.CipherType;

public class CipherTypeConverter implements ITypeConverter<CipherType> {

    @Override
    public CipherType convert(String value) {
        return CipherType.fromName(value);
    }
}
