package ai.mapper.syntax;

/**
 * Turns raw source text into the syntax-tree shapes the analysis needs.
 */
public interface ParserAdapter {

    PyAst.Module parse(String source) throws ParseException;
}
