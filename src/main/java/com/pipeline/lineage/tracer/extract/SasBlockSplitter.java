package com.pipeline.lineage.tracer.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Greedy split of a comment-free SAS program into PROC SQL and DATA step blocks.
 * An unterminated block runs to the end of the text.
 */
public class SasBlockSplitter {

    private static final Pattern START_SQL = Pattern.compile(
            "^\\s*proc\\s+sql\\b.*?;", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.DOTALL);
    private static final Pattern END_SQL = Pattern.compile("\\bquit\\s*;\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern START_DATA = Pattern.compile(
            "^\\s*data\\b.*?;", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.DOTALL);
    private static final Pattern END_DATA = Pattern.compile("\\brun\\s*;\\s*", Pattern.CASE_INSENSITIVE);

    public List<SasBlock> split(String text) {
        List<SasBlock> blocks = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            Matcher sql = START_SQL.matcher(text);
            Matcher data = START_DATA.matcher(text);
            boolean hasSql = sql.find(i);
            boolean hasData = data.find(i);
            if (!hasSql && !hasData) {
                break;
            }

            boolean sqlFirst = hasSql && (!hasData || sql.start() <= data.start());
            Matcher start = sqlFirst ? sql : data;
            Matcher end = (sqlFirst ? END_SQL : END_DATA).matcher(text);
            int j = end.find(start.end()) ? end.end() : n;

            // DATA blocks keep their header statement: it names the step's output tables
            int bodyStart = sqlFirst ? start.end() : start.start();
            blocks.add(new SasBlock(sqlFirst ? SasBlock.Type.SQL : SasBlock.Type.DATA,
                    start.start(), j, text.substring(bodyStart, j)));
            i = Math.max(j, i + 1);
        }
        return blocks;
    }
}
