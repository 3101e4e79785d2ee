package com.raditha.neardup.cli;

import com.raditha.neardup.hash.HashStrategy;
import picocli.CommandLine.ITypeConverter;

/**
 * Custom converter for HashStrategy enum to handle CLI string values.
 */
public class HashStrategyConverter implements ITypeConverter<HashStrategy> {

    @Override
    public HashStrategy convert(String value) throws Exception {
        return HashStrategy.fromString(value);
    }
}
