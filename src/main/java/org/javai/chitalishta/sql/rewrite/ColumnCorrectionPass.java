package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.chitalishta.sql.SchemaCatalog;
import org.javai.chitalishta.sql.rewrite.SqlTokens.Edit;

/**
 * Replaces known hallucinated column names with their catalog-provided correct names.
 * String literals are never touched; quoted identifiers keep their quotes.
 */
public class ColumnCorrectionPass implements RewritePass {

	public static final String NAME = "column-correction";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String apply(String sql, SchemaCatalog catalog) {
		if (catalog.columnCorrections().isEmpty()) {
			return sql;
		}
		List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
		List<Edit> edits = new ArrayList<>();
		for (int i = 0; i < tokens.size(); i++) {
			if (!SqlTokens.isIdentifier(tokens, i)) {
				continue;
			}
			SqlToken token = tokens.get(i);
			Optional<String> corrected = catalog.correctedColumnName(token.identifier());
			if (corrected.isPresent()) {
				String replacement = token.isWord() ? corrected.get() : "\"" + corrected.get() + "\"";
				edits.add(new Edit(i, i + 1, replacement));
			}
		}
		return edits.isEmpty() ? sql : SqlTokens.apply(tokens, edits);
	}
}
