package vn.legaldoc.structure.cli;

import picocli.CommandLine;
import vn.legaldoc.structure.parse.Dialect;

public class DialectConverter implements CommandLine.ITypeConverter<Dialect> {

    @Override
    public Dialect convert(String value) {
        return Dialect.from(value);
    }
}
