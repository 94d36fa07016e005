package com.depegscan.client;

/**
 * GraphQL documents sent to the lending API. Kept in one place so field lists stay consistent
 * between listing and single-entity queries.
 */
final class GraphQLQueries {
    private GraphQLQueries() {}

    static final String ASSET_FIELDS = "address symbol name decimals priceUsd";

    static final String MARKET_FIELDS = """
            uniqueKey listed lltv creationTimestamp oracleAddress
            loanAsset { %1$s }
            collateralAsset { %1$s }
            morphoBlue { chain { id network } }
            state {
              timestamp supplyAssets borrowAssets collateralAssets liquidityAssets
              supplyAssetsUsd borrowAssetsUsd collateralAssetsUsd liquidityAssetsUsd
              utilization price
            }
            badDebt { underlying usd }
            realizedBadDebt { underlying usd }
            warnings { type level }
            """.formatted(ASSET_FIELDS);

    static final String ORACLE_WITH_DATA = """
            oracle {
              address type
              data {
                ... on MorphoChainlinkOracleData {
                  baseFeedOne { address } baseFeedTwo { address }
                  quoteFeedOne { address } quoteFeedTwo { address }
                  baseOracleVault { address } scaleFactor
                }
                ... on MorphoChainlinkOracleV2Data {
                  baseFeedOne { address } baseFeedTwo { address }
                  quoteFeedOne { address } quoteFeedTwo { address }
                  baseOracleVault { address } quoteOracleVault { address } scaleFactor
                }
              }
            }
            """;

    static final String ORACLE_PLAIN = "oracle { address type }";

    static final String VAULT_FIELDS = """
            address name symbol listed creationTimestamp
            asset { %1$s }
            chain { id network }
            state {
              totalAssets totalAssetsUsd sharePriceNumber sharePriceUsd netApy fee timelock
              curator owner guardian
              curators { name verified }
              allocation {
                market {
                  uniqueKey lltv
                  loanAsset { %1$s }
                  collateralAsset { %1$s }
                }
                supplyAssets supplyAssetsUsd supplyCap supplyCapUsd enabled removableAt pendingSupplyCap
              }
            }
            publicAllocatorConfig { admin fee }
            """.formatted(ASSET_FIELDS);

    static final String REALLOCATION_FIELDS =
            "id timestamp hash type assets vault { address name } market { uniqueKey }";

    static final String PAGE_INFO = "pageInfo { count countTotal }";

    static final String MARKETS = """
            query Markets($first: Int!, $skip: Int!, $chainIds: [Int!]) {
              markets(first: $first, skip: $skip, where: { chainId_in: $chainIds }) {
                items { %s }
                %s
              }
            }
            """.formatted(MARKET_FIELDS, PAGE_INFO);

    static final String VAULTS_BY_MARKETS = """
            query VaultsByMarkets($first: Int!, $skip: Int!, $chainIds: [Int!], $marketKeys: [String!]) {
              vaults(first: $first, skip: $skip, where: { chainId_in: $chainIds, marketUniqueKey_in: $marketKeys }) {
                items { %s }
                %s
              }
            }
            """.formatted(VAULT_FIELDS, PAGE_INFO);

    static final String REALLOCATIONS_BY_MARKETS = """
            query ReallocationsByMarkets($first: Int!, $skip: Int!, $chainIds: [Int!], $marketKeys: [String!]) {
              vaultReallocates(first: $first, skip: $skip, orderBy: Timestamp, orderDirection: Asc,
                               where: { chainId_in: $chainIds, marketUniqueKey_in: $marketKeys }) {
                items { %s }
                %s
              }
            }
            """.formatted(REALLOCATION_FIELDS, PAGE_INFO);

    static final String REALLOCATIONS_BY_VAULTS = """
            query ReallocationsByVaults($first: Int!, $skip: Int!, $chainIds: [Int!], $vaults: [String!],
                                        $from: Int, $to: Int) {
              vaultReallocates(first: $first, skip: $skip, orderBy: Timestamp, orderDirection: Asc,
                               where: { chainId_in: $chainIds, vaultAddress_in: $vaults,
                                        timestamp_gte: $from, timestamp_lte: $to }) {
                items { %s }
                %s
              }
            }
            """.formatted(REALLOCATION_FIELDS, PAGE_INFO);

    static final String VAULT_BY_ADDRESS = """
            query VaultByAddress($address: String!, $chainId: Int) {
              vaultByAddress(address: $address, chainId: $chainId) { %s }
            }
            """.formatted(VAULT_FIELDS);

    static final String MARKET_BY_KEY = """
            query MarketByKey($uniqueKey: String!, $chainId: Int) {
              marketByUniqueKey(uniqueKey: $uniqueKey, chainId: $chainId) {
                %s
                %%s
                supplyingVaults { address name }
              }
            }
            """.formatted(MARKET_FIELDS);

    static final String VAULT_ALLOCATION_HISTORY = """
            query VaultAllocationHistory($address: String!, $chainId: Int, $options: TimeseriesOptions) {
              vaultByAddress(address: $address, chainId: $chainId) {
                address
                historicalState {
                  allocation {
                    market { uniqueKey collateralAsset { symbol } loanAsset { symbol } }
                    supplyAssetsUsd(options: $options) { x y }
                    supplyCap(options: $options) { x y }
                  }
                }
              }
            }
            """;

    static final String VAULT_ADMIN_EVENTS = """
            query VaultAdminEvents($address: String!, $chainId: Int, $first: Int!, $skip: Int!) {
              vaultByAddress(address: $address, chainId: $chainId) {
                adminEvents(first: $first, skip: $skip) {
                  items {
                    hash timestamp type
                    data {
                      ... on CapEventData { cap market { uniqueKey } }
                      ... on SetWithdrawQueueEventData { withdrawQueue { uniqueKey } }
                      ... on SetSupplyQueueEventData { supplyQueue { uniqueKey } }
                    }
                  }
                  %s
                }
              }
            }
            """.formatted(PAGE_INFO);

    static final String MARKET_HISTORY = """
            query MarketHistory($uniqueKey: String!, $chainId: Int, $options: TimeseriesOptions) {
              marketByUniqueKey(uniqueKey: $uniqueKey, chainId: $chainId) {
                uniqueKey
                historicalState {
                  utilization(options: $options) { x y }
                  supplyAssetsUsd(options: $options) { x y }
                  borrowAssetsUsd(options: $options) { x y }
                }
              }
            }
            """;

    static final String VAULT_SHARE_PRICE_HISTORY = """
            query VaultSharePriceHistory($address: String!, $chainId: Int, $options: TimeseriesOptions) {
              vaultByAddress(address: $address, chainId: $chainId) {
                address
                historicalState {
                  sharePriceNumber(options: $options) { x y }
                  totalAssetsUsd(options: $options) { x y }
                }
              }
            }
            """;

    static final String LIQUIDATIONS = """
            query Liquidations($first: Int!, $skip: Int!, $chainIds: [Int!], $marketKeys: [String!]) {
              transactions(first: $first, skip: $skip, orderBy: Timestamp, orderDirection: Desc,
                           where: { chainId_in: $chainIds, marketUniqueKey_in: $marketKeys,
                                    type_in: [MarketLiquidation] }) {
                items {
                  hash timestamp blockNumber type
                  user { address }
                  data {
                    ... on MarketLiquidationTransactionData {
                      seizedAssets repaidAssets seizedAssetsUsd repaidAssetsUsd badDebtAssetsUsd liquidator
                      market { uniqueKey }
                    }
                  }
                }
                %s
              }
            }
            """.formatted(PAGE_INFO);

    static final String BORROWER_POSITIONS = """
            query BorrowerPositions($first: Int!, $skip: Int!, $chainIds: [Int!], $marketKeys: [String!]) {
              marketPositions(first: $first, skip: $skip, orderBy: BorrowShares, orderDirection: Desc,
                              where: { chainId_in: $chainIds, marketUniqueKey_in: $marketKeys }) {
                items {
                  user { address }
                  healthFactor
                  market { uniqueKey }
                  state { collateral collateralUsd borrowAssets borrowAssetsUsd }
                }
                %s
              }
            }
            """.formatted(PAGE_INFO);

    static String marketByKey(boolean withOracleData) {
        return MARKET_BY_KEY.formatted(withOracleData ? ORACLE_WITH_DATA : ORACLE_PLAIN);
    }
}
